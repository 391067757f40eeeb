package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.api.analysis.DataflowAnalyzer;
import io.github.eutro.nativedec.api.stage.CallingStage;
import io.github.eutro.nativedec.api.stage.DataflowStage;
import io.github.eutro.nativedec.api.stage.FunctionsStage;
import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.calling.ConventionDetector;
import io.github.eutro.nativedec.core.calling.Conventions;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.dflow.Dataflow;
import io.github.eutro.nativedec.core.dflow.Dataflows;
import io.github.eutro.nativedec.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the dataflow facts of every function, under a fresh calling model.
 * <p>
 * On a stage with no calling information yet, starts from empty conventions and signatures.
 * Otherwise reuses those of the stage, dropping any dataflow facts it carries.
 */
public class DataflowAnalysis implements IRPass<FunctionsStage, DataflowStage> {
    private final DataflowAnalyzer analyzer;
    private final ConventionDetector conventionDetector;
    private final ForFunctions forFunctions;

    public DataflowAnalysis(DataflowAnalyzer analyzer, ConventionDetector conventionDetector, ForFunctions forFunctions) {
        this.analyzer = analyzer;
        this.conventionDetector = conventionDetector;
        this.forFunctions = forFunctions;
    }

    @Override
    public @Nullable DataflowStage run(FunctionsStage stage) {
        AnalysisContext context = stage.getContext();
        context.getLogToken().log("Dataflow analysis.");

        CallingStage calling = stage instanceof CallingStage
                ? (CallingStage) stage
                : new CallingStage(stage, new Conventions(), new Signatures());
        Hooks hooks = new Hooks(calling.getConventions(), calling.getSignatures());
        hooks.setConventionDetector(conventionDetector);

        Architecture architecture = context.getImage().getArchitecture();
        Dataflows dataflows = new Dataflows();
        boolean done = forFunctions.run(context, "Dataflow analysis", stage.getFunctions(), function -> {
            Dataflow dataflow = new Dataflow();
            analyzer.analyze(dataflow, function, architecture, hooks, context.getCancellationToken());
            dataflows.emplace(function, dataflow);
        });
        if (!done) return null;
        return new DataflowStage(calling, hooks, dataflows);
    }
}
