package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.stage.LivenessStage;
import io.github.eutro.nativedec.core.types.Types;

/**
 * Reconstructs the types of the live terms of the program.
 */
@FunctionalInterface
public interface TypeAnalyzer {
    Types reconstruct(LivenessStage stage);
}
