package com.linlay.analysisagent.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column names plus rows. Cells are JSON scalars only, so copying the row lists is a deep copy.
 */
public record DataTable(List<String> columns, List<List<Object>> rows) {

    private static final ObjectMapper CELL_MAPPER = new ObjectMapper();

    public DataTable {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = copyRows(rows);
    }

    public static DataTable of(List<String> columns, List<List<Object>> rows) {
        return new DataTable(columns, rows);
    }

    public static DataTable empty() {
        return new DataTable(List.of(), List.of());
    }

    public static DataTable fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return empty();
        }
        List<String> columns = new ArrayList<>();
        JsonNode columnsNode = node.path("columns");
        if (columnsNode.isArray()) {
            for (JsonNode column : columnsNode) {
                columns.add(column.isTextual() ? column.asText() : column.toString());
            }
        }
        JsonNode rowsNode = node.has("rows") ? node.get("rows") : node.path("data");
        List<List<Object>> rows = new ArrayList<>();
        if (rowsNode != null && rowsNode.isArray()) {
            for (JsonNode rowNode : rowsNode) {
                List<Object> row = new ArrayList<>();
                if (rowNode.isArray()) {
                    for (JsonNode cell : rowNode) {
                        row.add(toCell(cell));
                    }
                }
                rows.add(row);
            }
        }
        return new DataTable(columns, rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public DataTable copy() {
        return new DataTable(columns, rows);
    }

    public List<List<Object>> head(int limit) {
        return rows.subList(0, Math.min(Math.max(0, limit), rows.size()));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("columns", columns);
        map.put("rows", rows);
        return map;
    }

    private static Object toCell(JsonNode cell) {
        if (cell == null || cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        if (cell.isContainerNode()) {
            return cell.toString();
        }
        return CELL_MAPPER.convertValue(cell, Object.class);
    }

    private static List<List<Object>> copyRows(List<List<Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            // cells may be null, so no List.copyOf
            copied.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return Collections.unmodifiableList(copied);
    }
}
