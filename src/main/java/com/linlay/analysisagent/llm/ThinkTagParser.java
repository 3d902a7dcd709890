package com.linlay.analysisagent.llm;

/**
 * Splits {@code <think>...</think>} out of visible text as reasoning.
 * <p>
 * Each feed emits only the prefix known not to belong to a tag. A possible partial tag waits in a lookback
 * buffer of at most tag length minus one. Not thread-safe; one instance per stream.
 */
public final class ThinkTagParser {

    static final String OPEN_TAG = "<think>";
    static final String CLOSE_TAG = "</think>";

    private boolean insideTag;
    private String pending = "";

    public Segment feed(String delta) {
        if (delta == null || delta.isEmpty()) {
            return Segment.EMPTY;
        }
        StringBuilder visible = new StringBuilder();
        StringBuilder reasoning = new StringBuilder();
        String buffer = pending + delta;
        pending = "";
        while (!buffer.isEmpty()) {
            String tag = insideTag ? CLOSE_TAG : OPEN_TAG;
            int tagIndex = buffer.indexOf(tag);
            if (tagIndex >= 0) {
                target(visible, reasoning).append(buffer, 0, tagIndex);
                buffer = buffer.substring(tagIndex + tag.length());
                insideTag = !insideTag;
                continue;
            }
            int keep = partialTagSuffixLength(buffer, tag);
            target(visible, reasoning).append(buffer, 0, buffer.length() - keep);
            pending = buffer.substring(buffer.length() - keep);
            break;
        }
        return new Segment(visible.toString(), reasoning.toString());
    }

    // unclosed think content is still emitted as reasoning
    public Segment flush() {
        String rest = pending;
        pending = "";
        if (rest.isEmpty()) {
            return Segment.EMPTY;
        }
        return insideTag ? new Segment("", rest) : new Segment(rest, "");
    }

    public boolean isInsideTag() {
        return insideTag;
    }

    private StringBuilder target(StringBuilder visible, StringBuilder reasoning) {
        return insideTag ? reasoning : visible;
    }

    private int partialTagSuffixLength(String buffer, String tag) {
        int max = Math.min(buffer.length(), tag.length() - 1);
        for (int length = max; length > 0; length--) {
            if (tag.startsWith(buffer.substring(buffer.length() - length))) {
                return length;
            }
        }
        return 0;
    }

    public record Segment(String text, String reasoning) {

        static final Segment EMPTY = new Segment("", "");

        public boolean isEmpty() {
            return text.isEmpty() && reasoning.isEmpty();
        }
    }
}
