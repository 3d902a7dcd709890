package com.linlay.analysisagent.agent.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Component
public class ConversationCompressor {

    private static final Logger log = LoggerFactory.getLogger(ConversationCompressor.class);

    private static final DateTimeFormatter ARCHIVE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final int SUMMARY_MAX_ITEMS = 20;
    private static final int SUMMARY_LINE_MAX = 140;
    private static final int TOOL_ID_MAX = 32;
    private static final int SUMMARY_TOOL_NAMES = 4;

    private final WorkspaceStore workspaceStore;
    private final ObjectMapper objectMapper;

    public ConversationCompressor(WorkspaceStore workspaceStore, ObjectMapper objectMapper) {
        this.workspaceStore = workspaceStore;
        this.objectMapper = objectMapper;
    }

    public CompressionResult compress(Session session, double ratio, int minMessages) {
        List<ChatMessage> messages = session.messages();
        int total = messages.size();
        if (total < minMessages) {
            return CompressionResult.skipped(
                    "at least " + minMessages + " messages are required for compression", total);
        }
        int archiveCount = archiveCount(total, ratio, minMessages);
        // the archive boundary must not separate a tool result from its call
        while (archiveCount < total - 1 && ChatMessage.TOOL.equals(messages.get(archiveCount).role())) {
            archiveCount++;
        }
        List<ChatMessage> archived = messages.subList(0, archiveCount);
        List<ChatMessage> remaining = messages.subList(archiveCount, total);
        if (archived.isEmpty()) {
            return CompressionResult.skipped("no messages to archive", total);
        }

        String summary = summarize(archived);
        Path archivePath = archive(session.id(), archived);
        session.replaceMessages(new ArrayList<>(remaining));
        session.appendCompressedContext(summary);
        log.info("Compressed session history: session={}, archived={}, remaining={}, archive={}",
                session.id(), archived.size(), remaining.size(), archivePath);
        return new CompressionResult(true, "session history compressed", archived.size(), remaining.size(), summary, archivePath);
    }

    static int archiveCount(int total, double ratio, int minMessages) {
        double clamped = Math.min(Math.max(ratio, 0.1d), 0.9d);
        int count = Math.max(minMessages, (int) (total * clamped));
        if (count >= total) {
            count = Math.max(total - 1, 1);
        }
        return count;
    }

    static String summarize(List<ChatMessage> messages) {
        List<String> lines = new ArrayList<>();
        for (ChatMessage message : messages.subList(0, Math.min(SUMMARY_MAX_ITEMS, messages.size()))) {
            String role = message.role() == null || message.role().isBlank() ? "unknown" : message.role().trim();
            String content = trimText(message.content(), SUMMARY_LINE_MAX);
            if (ChatMessage.TOOL.equals(role)) {
                lines.add("- [tool:" + trimText(message.toolCallId(), TOOL_ID_MAX) + "] " + content);
                continue;
            }
            if (ChatMessage.ASSISTANT.equals(role) && message.hasToolCalls()) {
                List<String> names = message.toolCalls().stream()
                        .limit(SUMMARY_TOOL_NAMES)
                        .map(ToolCall::name)
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(name -> !name.isEmpty())
                        .toList();
                if (!names.isEmpty()) {
                    lines.add("- [assistant] called tools: " + String.join(", ", names));
                    if (!content.isEmpty()) {
                        lines.add("- [assistant] " + content);
                    }
                    continue;
                }
            }
            lines.add("- [" + role + "] " + content);
        }
        if (messages.size() > SUMMARY_MAX_ITEMS) {
            lines.add("- ... " + (messages.size() - SUMMARY_MAX_ITEMS) + " more messages omitted");
        }
        return String.join("\n", lines).trim();
    }

    static String trimText(String value, int maxLength) {
        String text = value == null ? "" : value.replace("\r", " ").replace("\n", " ").trim();
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }

    private Path archive(String sessionId, List<ChatMessage> archived) {
        Path dir = workspaceStore.archiveDir(sessionId);
        Path target = dir.resolve("compressed_" + LocalDateTime.now().format(ARCHIVE_TS) + ".json");
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), archived);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write compression archive: " + target, ex);
        }
        return target;
    }
}
