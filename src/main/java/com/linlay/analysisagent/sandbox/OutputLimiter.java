package com.linlay.analysisagent.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public final class OutputLimiter implements Runnable {

    public static final String TRUNCATED_SUFFIX = "\n...(truncated)";

    private final InputStream stream;
    private final int maxChars;
    private final StringBuilder out = new StringBuilder();
    private volatile boolean truncated;
    private volatile IOException failure;

    public OutputLimiter(InputStream stream, int maxChars) {
        this.stream = stream;
        this.maxChars = Math.max(256, maxChars);
    }

    public static Thread start(OutputLimiter limiter, String threadName) {
        Thread thread = new Thread(limiter, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + TRUNCATED_SUFFIX;
    }

    @Override
    public void run() {
        if (stream == null) {
            return;
        }
        try (InputStream input = stream; InputStreamReader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            char[] buffer = new char[1024];
            int len;
            while ((len = reader.read(buffer)) >= 0) {
                append(buffer, len);
            }
        } catch (IOException ex) {
            // the pipe closes when the process is killed; what was read so far is kept
            failure = ex;
        }
    }

    public synchronized String text() {
        if (!truncated) {
            return out.toString();
        }
        return out + TRUNCATED_SUFFIX;
    }

    public IOException failure() {
        return failure;
    }

    private synchronized void append(char[] chars, int len) {
        if (len <= 0) {
            return;
        }
        if (out.length() >= maxChars) {
            truncated = true;
            return;
        }
        int remain = maxChars - out.length();
        int toWrite = Math.min(remain, len);
        out.append(chars, 0, toWrite);
        if (toWrite < len) {
            truncated = true;
        }
    }
}
