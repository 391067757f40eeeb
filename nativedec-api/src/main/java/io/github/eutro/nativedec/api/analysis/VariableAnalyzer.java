package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.stage.DataflowStage;
import io.github.eutro.nativedec.core.vars.Variables;

/**
 * Coalesces memory accesses into variables.
 */
@FunctionalInterface
public interface VariableAnalyzer {
    Variables reconstruct(DataflowStage stage);
}
