package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.sandbox.CodeSandbox;
import com.linlay.analysisagent.sandbox.DataTable;
import com.linlay.analysisagent.sandbox.OutputLimiter;
import com.linlay.analysisagent.sandbox.ResultValue;
import com.linlay.analysisagent.sandbox.SandboxFigure;
import com.linlay.analysisagent.sandbox.SandboxRequest;
import com.linlay.analysisagent.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public abstract class AbstractCodeExecutionTool extends AbstractAnalysisTool {

    private static final Logger log = LoggerFactory.getLogger(AbstractCodeExecutionTool.class);

    public static final List<String> PURPOSES = List.of("exploration", "visualization", "export", "transformation");

    static final int PREVIEW_ROWS = 20;
    static final int MESSAGE_OUTPUT_CHARS = 2000;
    private static final DateTimeFormatter FIGURE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CodeSandbox sandbox;
    private final WorkspaceStore workspaceStore;

    protected AbstractCodeExecutionTool(CodeSandbox sandbox, WorkspaceStore workspaceStore) {
        this.sandbox = sandbox;
        this.workspaceStore = workspaceStore;
    }

    protected abstract String languageLabel();

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("code", Map.of("type", "string", "description", languageLabel() + " code to execute"));
        properties.put("dataset_name", Map.of("type", "string", "description", "dataset bound as df before execution"));
        properties.put("persist_df", Map.of("type", "boolean", "description", "write dataset changes back to the session"));
        properties.put("save_as", Map.of("type", "string", "description", "store a tabular result as a new dataset"));
        properties.put("purpose", Map.of("type", "string", "enum", PURPOSES,
                "description", "visualization and export keep the code as a downloadable artifact"));
        properties.put("label", Map.of("type", "string", "description", "short name for the generated artifact"));
        properties.put("intent", Map.of("type", "string", "description", "one sentence describing what the code does"));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("code"));
        return schema;
    }

    @Override
    public JsonNode invoke(Session session, Map<String, Object> args) {
        String code = readCode(args, "code");
        if (code == null) {
            return failure("code must not be empty");
        }
        String datasetName = readText(args, "dataset_name");
        if (datasetName != null && !session.hasDataset(datasetName)) {
            return failure("dataset '" + datasetName + "' does not exist");
        }
        boolean persist = readBoolean(args, "persist_df", false);
        String saveAs = readText(args, "save_as");

        SandboxRequest request = SandboxRequest.of(session.id(), code, session.datasets())
                .withDataset(datasetName, persist);
        SandboxResult result = sandbox.execute(request);
        if (!result.success()) {
            return executionFailure(result);
        }
        return executionSuccess(session, result, datasetName, persist, saveAs);
    }

    private ObjectNode executionFailure(SandboxResult result) {
        String error = result.error() == null ? "unknown error" : result.error();
        ObjectNode node = failure(languageLabel() + " code execution failed: " + error);
        ObjectNode data = node.putObject("data");
        data.put("stdout", OutputLimiter.truncate(result.stdout(), MESSAGE_OUTPUT_CHARS));
        data.put("stderr", OutputLimiter.truncate(result.stderr(), MESSAGE_OUTPUT_CHARS));
        data.put("traceback", OutputLimiter.truncate(result.traceback(), MESSAGE_OUTPUT_CHARS));
        data.put("error_kind", result.errorKind() == null ? "CODE" : result.errorKind().name());
        return node;
    }

    private ObjectNode executionSuccess(
            Session session,
            SandboxResult result,
            String datasetName,
            boolean persist,
            String saveAs
    ) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("success", true);
        ObjectNode data = OBJECT_MAPPER.createObjectNode();

        List<String> updated = new ArrayList<>();
        if (persist) {
            result.updatedDatasets().forEach((name, table) -> {
                session.putDataset(name, table);
                updated.add(name);
            });
        }

        ResultValue value = result.result();
        if (value instanceof ResultValue.Table table) {
            node.put("has_dataframe", true);
            node.set("dataframe_preview", OBJECT_MAPPER.valueToTree(preview(table.table())));
            data.put("rows", table.table().rowCount());
            data.put("columns", table.table().columnCount());
            if (saveAs != null) {
                session.putDataset(saveAs, table.table());
                data.put("dataset_name", saveAs);
                updated.add(saveAs);
            }
        } else if (value != null) {
            data.set("result", OBJECT_MAPPER.valueToTree(value.toMap()));
        }
        if (datasetName != null && !data.has("dataset_name")) {
            data.put("dataset_name", datasetName);
        }

        List<Map<String, Object>> artifacts = new ArrayList<>();
        List<String> images = new ArrayList<>();
        int index = 0;
        for (SandboxFigure figure : result.figures()) {
            index++;
            collectFigure(session, figure, index, node, artifacts, images);
        }
        node.put("has_chart", node.has("chart_data") || !images.isEmpty());
        if (!artifacts.isEmpty()) {
            node.set("artifacts", OBJECT_MAPPER.valueToTree(artifacts));
        }
        if (!images.isEmpty()) {
            node.set("images", OBJECT_MAPPER.valueToTree(images));
        }

        data.put("stdout", OutputLimiter.truncate(result.stdout(), MESSAGE_OUTPUT_CHARS));
        data.put("stderr", OutputLimiter.truncate(result.stderr(), MESSAGE_OUTPUT_CHARS));
        data.put("figure_count", result.figures().size());
        if (!updated.isEmpty()) {
            data.set("updated_datasets", OBJECT_MAPPER.valueToTree(updated));
        }
        node.put("message", successMessage(result, updated));
        node.set("data", data);
        return node;
    }

    private void collectFigure(
            Session session,
            SandboxFigure figure,
            int index,
            ObjectNode node,
            List<Map<String, Object>> artifacts,
            List<String> images
    ) {
        String stem = figureStem(figure, index);
        try {
            if (figure.isFile()) {
                Map<String, Object> artifact = workspaceStore.registerFile(session.id(), figure.path(), "chart");
                artifact.put("render_engine", figure.library());
                artifacts.add(artifact);
                if (isImageFormat(figure.format())) {
                    images.add(String.valueOf(artifact.get("path")));
                }
                return;
            }
            if (figure.json() != null) {
                if (!node.has("chart_data")) {
                    node.set("chart_data", OBJECT_MAPPER.readTree(figure.json()));
                }
                Map<String, Object> artifact = workspaceStore.saveArtifact(
                        session.id(), stem + ".json", figure.json().getBytes(StandardCharsets.UTF_8), "chart");
                artifact.put("render_engine", figure.library());
                artifacts.add(artifact);
                return;
            }
            if (figure.svg() != null) {
                Map<String, Object> artifact = workspaceStore.saveArtifact(
                        session.id(), stem + ".svg", figure.svg().getBytes(StandardCharsets.UTF_8), "chart");
                artifact.put("render_engine", figure.library());
                artifacts.add(artifact);
            }
            if (figure.pngBase64() != null) {
                Map<String, Object> artifact = workspaceStore.saveArtifact(
                        session.id(), stem + ".png", Base64.getDecoder().decode(figure.pngBase64()), "chart");
                artifact.put("render_engine", figure.library());
                artifacts.add(artifact);
                images.add(String.valueOf(artifact.get("path")));
            }
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Skip malformed figure payload: library={}, title={}", figure.library(), figure.title(), ex);
        }
    }

    private String successMessage(SandboxResult result, List<String> updated) {
        StringBuilder message = new StringBuilder(languageLabel()).append(" code executed successfully");
        if (!updated.isEmpty()) {
            message.append("; datasets updated: ").append(String.join(", ", updated));
        }
        if (!result.stdout().isBlank()) {
            message.append("\nstdout:\n").append(OutputLimiter.truncate(result.stdout().strip(), MESSAGE_OUTPUT_CHARS));
        }
        if (!result.stderr().isBlank()) {
            message.append("\nstderr:\n").append(OutputLimiter.truncate(result.stderr().strip(), MESSAGE_OUTPUT_CHARS));
        }
        return message.toString();
    }

    static Map<String, Object> preview(DataTable table) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (List<Object> row : table.head(PREVIEW_ROWS)) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < table.columns().size(); i++) {
                record.put(table.columns().get(i), i < row.size() ? row.get(i) : null);
            }
            records.add(record);
        }
        List<Map<String, Object>> columns = new ArrayList<>();
        for (String column : table.columns()) {
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("name", column);
            columns.add(descriptor);
        }
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("data", records);
        preview.put("columns", columns);
        preview.put("total_rows", table.rowCount());
        preview.put("preview_rows", records.size());
        return preview;
    }

    private static String figureStem(SandboxFigure figure, int index) {
        String base = figure.title().isBlank() ? "figure" : WorkspaceStore.safeFileName(figure.title());
        return base + "_" + LocalDateTime.now().format(FIGURE_TS) + "_" + index;
    }

    private static boolean isImageFormat(String format) {
        String normalized = format == null ? "" : format.toLowerCase(Locale.ROOT);
        return "png".equals(normalized) || "svg".equals(normalized) || "jpg".equals(normalized) || "jpeg".equals(normalized);
    }
}
