package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.analysis.StructureAnalyzer;
import io.github.eutro.nativedec.api.stage.StructureStage;
import io.github.eutro.nativedec.api.stage.VariablesStage;
import io.github.eutro.nativedec.core.cflow.Graphs;
import io.github.eutro.nativedec.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Recovers the structured control-flow graph of every function.
 */
public class StructuralAnalysis implements IRPass<VariablesStage, StructureStage> {
    private final StructureAnalyzer analyzer;
    private final ForFunctions forFunctions;

    public StructuralAnalysis(StructureAnalyzer analyzer, ForFunctions forFunctions) {
        this.analyzer = analyzer;
        this.forFunctions = forFunctions;
    }

    @Override
    public @Nullable StructureStage run(VariablesStage stage) {
        stage.getContext().getLogToken().log("Structural analysis.");
        Graphs graphs = new Graphs();
        boolean done = forFunctions.run(stage.getContext(), "Structural analysis", stage.getFunctions(),
                function -> graphs.emplace(function, analyzer.analyze(function, stage.getDataflows().at(function))));
        if (!done) return null;
        return new StructureStage(stage, graphs);
    }
}
