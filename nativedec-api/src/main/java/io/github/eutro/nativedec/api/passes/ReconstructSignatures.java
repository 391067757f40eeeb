package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.analysis.SignatureAnalyzer;
import io.github.eutro.nativedec.api.stage.CallingStage;
import io.github.eutro.nativedec.api.stage.DataflowStage;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.passes.IRPass;

/**
 * Reconstructs function signatures from the dataflow facts of all functions.
 * <p>
 * The result no longer carries dataflow facts, which must be recomputed under the new signatures.
 */
public class ReconstructSignatures implements IRPass<DataflowStage, CallingStage> {
    private final SignatureAnalyzer analyzer;

    public ReconstructSignatures(SignatureAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public CallingStage run(DataflowStage stage) {
        stage.getContext().getLogToken().log("Reconstructing function signatures.");
        Signatures signatures = analyzer.reconstruct(stage);
        return new CallingStage(stage, stage.getConventions(), signatures);
    }
}
