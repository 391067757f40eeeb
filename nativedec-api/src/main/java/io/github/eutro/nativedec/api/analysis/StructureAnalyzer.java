package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.core.cflow.Graph;
import io.github.eutro.nativedec.core.dflow.Dataflow;
import io.github.eutro.nativedec.core.ir.Function;

/**
 * Recovers the structured control flow of a function.
 * <p>
 * May be called for several functions at once, from different threads.
 */
@FunctionalInterface
public interface StructureAnalyzer {
    Graph analyze(Function function, Dataflow dataflow);
}
