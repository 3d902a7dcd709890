package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.sandbox.DataTable;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class GenerateReportTool extends AbstractAnalysisTool {

    public static final String NAME = "generate_report";
    public static final String REPORT_MARKDOWN = "report_markdown";

    private static final DateTimeFormatter REPORT_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final WorkspaceStore workspaceStore;

    public GenerateReportTool(WorkspaceStore workspaceStore) {
        this.workspaceStore = workspaceStore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Compose the final analysis report in Markdown from a title, summary, sections and conclusions. "
                + "The report is saved to the session workspace and shown to the user verbatim.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> section = Map.of(
                "type", "object",
                "properties", Map.of(
                        "heading", Map.of("type", "string"),
                        "content", Map.of("type", "string")
                ),
                "required", List.of("heading", "content")
        );
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", Map.of("type", "string"));
        properties.put("summary", Map.of("type", "string"));
        properties.put("sections", Map.of("type", "array", "items", section));
        properties.put("conclusions", Map.of("type", "string"));
        properties.put("include_datasets", Map.of("type", "boolean", "description", "append a dataset overview table"));
        properties.put("include_artifacts", Map.of("type", "boolean", "description", "list generated artifacts"));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("title"));
        return schema;
    }

    @Override
    public JsonNode invoke(Session session, Map<String, Object> args) {
        String title = readText(args, "title");
        if (title == null) {
            return failure("title must not be empty");
        }
        String markdown = render(session, title, args);
        String fileName = WorkspaceStore.safeFileName(title) + "_" + LocalDateTime.now().format(REPORT_TS) + ".md";
        Map<String, Object> artifact = workspaceStore.saveReport(session.id(), fileName, markdown);

        ObjectNode result = OBJECT_MAPPER.createObjectNode();
        result.put("success", true);
        result.put("message", "report generated: " + artifact.get("name"));
        ObjectNode data = result.putObject("data");
        data.put("name", String.valueOf(artifact.get("name")));
        data.put(REPORT_MARKDOWN, markdown);
        data.put("path", String.valueOf(artifact.get("path")));
        result.set("artifacts", OBJECT_MAPPER.valueToTree(List.of(artifact)));
        return result;
    }

    String render(Session session, String title, Map<String, Object> args) {
        StringBuilder markdown = new StringBuilder();
        markdown.append("# ").append(title).append("\n\n");
        String summary = readText(args, "summary");
        if (summary != null) {
            markdown.append("## Summary\n\n").append(summary).append("\n\n");
        }
        if (readBoolean(args, "include_datasets", true) && !session.datasets().isEmpty()) {
            markdown.append("## Datasets\n\n| Dataset | Rows | Columns |\n| --- | ---: | ---: |\n");
            for (Map.Entry<String, DataTable> entry : session.datasets().entrySet()) {
                markdown.append("| ").append(escapeCell(entry.getKey()))
                        .append(" | ").append(entry.getValue().rowCount())
                        .append(" | ").append(entry.getValue().columnCount())
                        .append(" |\n");
            }
            markdown.append('\n');
        }
        Object sections = args == null ? null : args.get("sections");
        if (sections instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map && map.get("heading") != null) {
                    markdown.append("## ").append(String.valueOf(map.get("heading")).trim()).append("\n\n");
                    Object content = map.get("content");
                    if (content != null && !content.toString().isBlank()) {
                        markdown.append(content.toString().strip()).append("\n\n");
                    }
                }
            }
        }
        if (readBoolean(args, "include_artifacts", true)) {
            List<Map<String, Object>> artifacts = workspaceStore.listArtifacts(session.id());
            if (!artifacts.isEmpty()) {
                markdown.append("## Artifacts\n\n");
                for (Map<String, Object> artifact : artifacts) {
                    markdown.append("- ").append(artifact.get("name"))
                            .append(" (").append(artifact.get("type")).append(")\n");
                }
                markdown.append('\n');
            }
        }
        String conclusions = readText(args, "conclusions");
        if (conclusions != null) {
            markdown.append("## Conclusions\n\n").append(conclusions).append("\n\n");
        }
        return markdown.toString().strip() + "\n";
    }

    private static String escapeCell(String value) {
        return value.replace("|", "\\|");
    }
}
