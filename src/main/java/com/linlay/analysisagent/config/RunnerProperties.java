package com.linlay.analysisagent.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "agent.runner")
public class RunnerProperties {

    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are a research data analysis assistant. Analyze the loaded datasets with the available tools.
            For multi-step work, first reply with a numbered plan, one step per line, in the form
            "1. step title - Tool: tool_name", then call the tools step by step.
            Use run_code for Python analysis and run_r_code for R analysis. When the analysis is complete,
            call generate_report or answer in plain text.
            """;

    // 0 means unlimited
    @Min(0)
    private int maxIterations = 0;
    private boolean autoCompressEnabled = true;

    @Min(1)
    private int autoCompressThresholdTokens = 30_000;
    @DecimalMin("0.1")
    @DecimalMax("0.9")
    private double compressRatio = 0.5;
    @Min(1)
    private int compressMinMessages = 4;
    @Min(0)
    private int minRecentMessages = 4;
    @Min(100)
    private int maxToolResultChars = 2000;
    @Min(100)
    private int datasetSummaryMaxChars = 1200;
    @Min(100)
    private int knowledgeMaxChars = 3000;

    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;
    private String sessionsDir = "data/sessions";

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public boolean isAutoCompressEnabled() {
        return autoCompressEnabled;
    }

    public void setAutoCompressEnabled(boolean autoCompressEnabled) {
        this.autoCompressEnabled = autoCompressEnabled;
    }

    public int getAutoCompressThresholdTokens() {
        return autoCompressThresholdTokens;
    }

    public void setAutoCompressThresholdTokens(int autoCompressThresholdTokens) {
        this.autoCompressThresholdTokens = autoCompressThresholdTokens;
    }

    public double getCompressRatio() {
        return compressRatio;
    }

    public void setCompressRatio(double compressRatio) {
        this.compressRatio = compressRatio;
    }

    public int getCompressMinMessages() {
        return compressMinMessages;
    }

    public void setCompressMinMessages(int compressMinMessages) {
        this.compressMinMessages = compressMinMessages;
    }

    public int getMinRecentMessages() {
        return minRecentMessages;
    }

    public void setMinRecentMessages(int minRecentMessages) {
        this.minRecentMessages = minRecentMessages;
    }

    public int getMaxToolResultChars() {
        return maxToolResultChars;
    }

    public void setMaxToolResultChars(int maxToolResultChars) {
        this.maxToolResultChars = maxToolResultChars;
    }

    public int getDatasetSummaryMaxChars() {
        return datasetSummaryMaxChars;
    }

    public void setDatasetSummaryMaxChars(int datasetSummaryMaxChars) {
        this.datasetSummaryMaxChars = datasetSummaryMaxChars;
    }

    public int getKnowledgeMaxChars() {
        return knowledgeMaxChars;
    }

    public void setKnowledgeMaxChars(int knowledgeMaxChars) {
        this.knowledgeMaxChars = knowledgeMaxChars;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getSessionsDir() {
        return sessionsDir;
    }

    public void setSessionsDir(String sessionsDir) {
        this.sessionsDir = sessionsDir;
    }
}
