package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.CancellationToken;
import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.dflow.Dataflow;
import io.github.eutro.nativedec.core.ir.Function;

/**
 * Computes the reaching definitions, memory locations and values of the terms of a function.
 * <p>
 * May be called for several functions at once, from different threads.
 */
@FunctionalInterface
public interface DataflowAnalyzer {
    /**
     * Analyse a function.
     *
     * @param dataflow          Where to record the facts.
     * @param function          The function.
     * @param architecture      The architecture.
     * @param hooks             The calling model. The analyzer records the callee of each call it resolves.
     * @param cancellationToken The token to poll while analysing.
     */
    void analyze(
            Dataflow dataflow,
            Function function,
            Architecture architecture,
            Hooks hooks,
            CancellationToken cancellationToken
    );
}
