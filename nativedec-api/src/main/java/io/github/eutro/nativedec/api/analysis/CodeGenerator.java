package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.stage.TypesStage;
import io.github.eutro.nativedec.core.likec.Tree;

/**
 * Generates the output syntax tree, omitting what is not live.
 */
@FunctionalInterface
public interface CodeGenerator {
    Tree generate(TypesStage stage);
}
