package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.analysis.TypeAnalyzer;
import io.github.eutro.nativedec.api.stage.LivenessStage;
import io.github.eutro.nativedec.api.stage.TypesStage;
import io.github.eutro.nativedec.core.passes.IRPass;

public class ReconstructTypes implements IRPass<LivenessStage, TypesStage> {
    private final TypeAnalyzer analyzer;

    public ReconstructTypes(TypeAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public TypesStage run(LivenessStage stage) {
        stage.getContext().getLogToken().log("Reconstructing types.");
        return new TypesStage(stage, analyzer.reconstruct(stage));
    }
}
