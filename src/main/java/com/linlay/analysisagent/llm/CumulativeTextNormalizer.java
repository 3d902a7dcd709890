package com.linlay.analysisagent.llm;

/**
 * Turns provider text frames into true deltas. Providers flagged with {@code cumulative-text}
 * resend the full text so far in every frame; all others already send increments.
 */
public final class CumulativeTextNormalizer {

    private final boolean cumulative;
    private final StringBuilder accumulated = new StringBuilder();

    public CumulativeTextNormalizer(boolean cumulative) {
        this.cumulative = cumulative;
    }

    public String toDelta(String incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return "";
        }
        if (!cumulative) {
            accumulated.append(incoming);
            return incoming;
        }
        String seen = accumulated.toString();
        if (incoming.startsWith(seen)) {
            String delta = incoming.substring(seen.length());
            accumulated.append(delta);
            return delta;
        }
        // snapshot no longer extends what was sent, restart from it
        accumulated.setLength(0);
        accumulated.append(incoming);
        return incoming;
    }

    public String accumulated() {
        return accumulated.toString();
    }
}
