package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.stage.DataflowStage;
import io.github.eutro.nativedec.core.calling.Signatures;

/**
 * Reconstructs the signatures of functions from the dataflow facts of the whole program.
 */
@FunctionalInterface
public interface SignatureAnalyzer {
    Signatures reconstruct(DataflowStage stage);
}
