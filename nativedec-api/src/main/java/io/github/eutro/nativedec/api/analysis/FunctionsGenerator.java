package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.core.ir.Functions;
import io.github.eutro.nativedec.core.ir.Program;

/**
 * Partitions the blocks of a program into functions.
 */
@FunctionalInterface
public interface FunctionsGenerator {
    Functions makeFunctions(Program program);
}
