package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.llm.model.ToolCall;
import com.linlay.analysisagent.llm.model.ToolCallDelta;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class ToolCallAccumulator {

    private final TreeMap<Integer, PendingCall> pending = new TreeMap<>();
    private Integer lastIndex;

    public void accept(ToolCallDelta delta) {
        if (delta == null) {
            return;
        }
        int index = resolveIndex(delta);
        PendingCall call = pending.computeIfAbsent(index, ignored -> new PendingCall());
        if (hasText(delta.id())) {
            call.id = delta.id();
        }
        if (hasText(delta.type())) {
            call.type = delta.type();
        }
        if (hasText(delta.name())) {
            call.appendName(delta.name());
        }
        if (delta.arguments() != null) {
            call.arguments.append(delta.arguments());
        }
        lastIndex = index;
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public List<ToolCall> drain() {
        List<ToolCall> calls = new ArrayList<>(pending.size());
        for (PendingCall call : pending.values()) {
            calls.add(new ToolCall(call.id, call.type, call.name.toString(), call.arguments.toString()));
        }
        pending.clear();
        lastIndex = null;
        return calls;
    }

    private int resolveIndex(ToolCallDelta delta) {
        if (delta.index() != null) {
            return delta.index();
        }
        if (hasText(delta.id())) {
            for (Map.Entry<Integer, PendingCall> entry : pending.entrySet()) {
                if (delta.id().equals(entry.getValue().id)) {
                    return entry.getKey();
                }
            }
            return pending.isEmpty() ? 0 : pending.lastKey() + 1;
        }
        return lastIndex == null ? 0 : lastIndex;
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }

    private static final class PendingCall {
        private String id = "";
        private String type = "function";
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();

        private void appendName(String fragment) {
            String current = name.toString();
            if (current.isEmpty() || fragment.startsWith(current)) {
                // first fragment, or the provider resent the full name
                name.setLength(0);
                name.append(fragment);
                return;
            }
            name.append(fragment);
        }
    }
}
