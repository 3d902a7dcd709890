package com.linlay.analysisagent.tool;

import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.sandbox.python.PythonSandboxExecutor;
import org.springframework.stereotype.Component;

@Component
public class RunCodeTool extends AbstractCodeExecutionTool {

    public static final String NAME = "run_code";

    public RunCodeTool(PythonSandboxExecutor sandbox, WorkspaceStore workspaceStore) {
        super(sandbox, workspaceStore);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Run Python code in an isolated sandbox. Loaded datasets are available as `datasets`, "
                + "the dataset named by dataset_name is bound as `df`. Assign `result` to return a value "
                + "and `output_df` to return a table; matplotlib and plotly figures are collected automatically.";
    }

    @Override
    protected String languageLabel() {
        return "Python";
    }
}
