package com.linlay.analysisagent.tool;

import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.sandbox.r.RSandboxExecutor;
import org.springframework.stereotype.Component;

@Component
public class RunRCodeTool extends AbstractCodeExecutionTool {

    public static final String NAME = "run_r_code";

    public RunRCodeTool(RSandboxExecutor sandbox, WorkspaceStore workspaceStore) {
        super(sandbox, workspaceStore);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Run R code with Rscript in an isolated working directory. The dataset named by dataset_name is "
                + "bound as `df`; assign `result` or `output_df` to return values. Plots drawn on the default "
                + "device or saved ggplot objects are collected as chart artifacts. Missing CRAN/Bioconductor "
                + "packages are installed automatically when enabled.";
    }

    @Override
    protected String languageLabel() {
        return "R";
    }
}
