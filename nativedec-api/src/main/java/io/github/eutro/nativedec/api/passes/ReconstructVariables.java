package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.analysis.VariableAnalyzer;
import io.github.eutro.nativedec.api.stage.DataflowStage;
import io.github.eutro.nativedec.api.stage.VariablesStage;
import io.github.eutro.nativedec.core.passes.IRPass;

public class ReconstructVariables implements IRPass<DataflowStage, VariablesStage> {
    private final VariableAnalyzer analyzer;

    public ReconstructVariables(VariableAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public VariablesStage run(DataflowStage stage) {
        stage.getContext().getLogToken().log("Reconstructing variables.");
        return new VariablesStage(stage, analyzer.reconstruct(stage));
    }
}
