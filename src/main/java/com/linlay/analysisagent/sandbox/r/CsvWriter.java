package com.linlay.analysisagent.sandbox.r;

import com.linlay.analysisagent.sandbox.DataTable;

import java.util.List;

// null is an empty field (NA in R), an empty string is written as ""
final class CsvWriter {

    private CsvWriter() {
    }

    static String write(DataTable table) {
        StringBuilder out = new StringBuilder();
        appendRow(out, List.copyOf(table.columns()));
        for (List<Object> row : table.rows()) {
            appendRow(out, row);
        }
        return out.toString();
    }

    private static void appendRow(StringBuilder out, List<?> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(cell(cells.get(i)));
        }
        out.append('\n');
    }

    static String cell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        String text = value.toString();
        if (text.isEmpty()) {
            return "\"\"";
        }
        if (text.indexOf(',') >= 0 || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0
                || !text.equals(text.strip())) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }
}
