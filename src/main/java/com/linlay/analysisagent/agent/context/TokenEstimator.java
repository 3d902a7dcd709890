package com.linlay.analysisagent.agent.context;

import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ToolCall;

import java.util.List;

// 1.5 per CJK character, 0.25 per word, plus a tenth of the length
public final class TokenEstimator {

    private static final int MESSAGE_OVERHEAD = 4;
    private static final int REPLY_OVERHEAD = 2;

    private TokenEstimator() {
    }

    public static int estimateText(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int cjk = 0;
        StringBuilder ascii = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= '\u4e00' && ch <= '\u9fff') {
                cjk++;
            }
            if (ch < 128) {
                ascii.append(ch);
            }
        }
        int words = 0;
        for (String token : ascii.toString().trim().split("\\s+")) {
            if (!token.isEmpty()) {
                words++;
            }
        }
        int length = text.codePointCount(0, text.length());
        return (int) (cjk * 1.5 + words * 0.25 + length * 0.1);
    }

    public static int estimate(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return REPLY_OVERHEAD;
        }
        int total = 0;
        for (ChatMessage message : messages) {
            total += estimate(message);
        }
        return total + REPLY_OVERHEAD;
    }

    static int estimate(ChatMessage message) {
        if (message == null) {
            return 0;
        }
        int total = MESSAGE_OVERHEAD + estimateText(message.content());
        if (message.hasToolCalls()) {
            for (ToolCall call : message.toolCalls()) {
                total += estimateText(call.name()) + estimateText(call.arguments());
            }
        }
        return total;
    }
}
