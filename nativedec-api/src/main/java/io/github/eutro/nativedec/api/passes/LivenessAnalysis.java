package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.stage.LivenessStage;
import io.github.eutro.nativedec.api.stage.StructureStage;
import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.liveness.Liveness;
import io.github.eutro.nativedec.core.liveness.LivenessAnalyzer;
import io.github.eutro.nativedec.core.liveness.Livenesses;
import io.github.eutro.nativedec.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the {@link Liveness} of every function.
 */
public class LivenessAnalysis implements IRPass<StructureStage, LivenessStage> {
    private final boolean preferConstants;
    private final ForFunctions forFunctions;

    public LivenessAnalysis(boolean preferConstants, ForFunctions forFunctions) {
        this.preferConstants = preferConstants;
        this.forFunctions = forFunctions;
    }

    @Override
    public @Nullable LivenessStage run(StructureStage stage) {
        stage.getContext().getLogToken().log("Liveness analysis.");
        Architecture architecture = stage.getContext().getImage().getArchitecture();
        Livenesses livenesses = new Livenesses();
        boolean done = forFunctions.run(stage.getContext(), "Liveness analysis", stage.getFunctions(), function -> {
            Liveness liveness = new Liveness();
            new LivenessAnalyzer(
                    liveness,
                    function,
                    stage.getDataflows().at(function),
                    architecture,
                    stage.getGraphs().at(function),
                    stage.getHooks(),
                    stage.getSignatures(),
                    preferConstants
            ).analyze();
            liveness.freeze();
            livenesses.emplace(function, liveness);
        });
        if (!done) return null;
        return new LivenessStage(stage, livenesses);
    }
}
