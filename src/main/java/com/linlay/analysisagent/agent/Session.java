package com.linlay.analysisagent.agent;

import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.sandbox.DataTable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class Session {

    static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

    private final String id;
    private final Instant createdAt;
    private final List<ChatMessage> messages = new ArrayList<>();
    private final Map<String, DataTable> datasets = new LinkedHashMap<>();
    private String compressedContext = "";
    private int compressionCount;
    private int iterationCount;
    private Instant lastCompressedAt;

    public Session() {
        this(UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    public Session(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
        this.id = id.trim();
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized List<ChatMessage> messages() {
        return List.copyOf(messages);
    }

    public synchronized int messageCount() {
        return messages.size();
    }

    public synchronized ChatMessage lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public synchronized void addMessage(ChatMessage message) {
        if (message != null) {
            messages.add(message);
        }
    }

    public void addUserMessage(String content) {
        addMessage(ChatMessage.user(content));
    }

    public void addAssistantMessage(String content) {
        addMessage(ChatMessage.assistant(content));
    }

    public void addToolResult(String toolCallId, String toolName, String content) {
        addMessage(ChatMessage.tool(toolCallId, toolName, content));
    }

    // notes are UI-only records and never reach the model
    public void addNote(String eventType, String content, Map<String, Object> metadata) {
        addMessage(ChatMessage.note(eventType, content, metadata));
    }

    public synchronized void replaceMessages(List<ChatMessage> remaining) {
        messages.clear();
        if (remaining != null) {
            messages.addAll(remaining);
        }
    }

    public synchronized Map<String, DataTable> datasets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    public synchronized DataTable dataset(String name) {
        return name == null ? null : datasets.get(name);
    }

    public synchronized boolean hasDataset(String name) {
        return name != null && datasets.containsKey(name);
    }

    public synchronized void putDataset(String name, DataTable table) {
        if (name == null || name.isBlank() || table == null) {
            throw new IllegalArgumentException("dataset name and table are required");
        }
        datasets.put(name.trim(), table);
    }

    public synchronized void removeDataset(String name) {
        datasets.remove(name);
    }

    public synchronized String compressedContext() {
        return compressedContext;
    }

    public synchronized boolean hasCompressedContext() {
        return !compressedContext.isBlank();
    }

    public synchronized void appendCompressedContext(String summary) {
        if (summary == null || summary.isBlank()) {
            return;
        }
        compressedContext = compressedContext.isBlank()
                ? summary.trim()
                : compressedContext + CONTEXT_SEPARATOR + summary.trim();
        compressionCount++;
        lastCompressedAt = Instant.now();
    }

    public synchronized int compressionCount() {
        return compressionCount;
    }

    public synchronized Instant lastCompressedAt() {
        return lastCompressedAt;
    }

    public synchronized int iterationCount() {
        return iterationCount;
    }

    public synchronized void incrementIterations() {
        iterationCount++;
    }
}
