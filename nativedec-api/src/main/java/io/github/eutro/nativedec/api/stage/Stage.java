package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.api.AnalysisContext;

/**
 * The artifacts available after some pass of the decompiler pipeline.
 * <p>
 * Each pass consumes a stage and returns the next. The type of a stage
 * guarantees which artifacts exist: every stage carries the artifacts of
 * the stages it extends. A stage is never mutated after the pass that
 * produced it returns.
 */
public abstract class Stage {
    private final AnalysisContext context;

    protected Stage(AnalysisContext context) {
        this.context = context;
    }

    /**
     * Get the context this stage belongs to.
     *
     * @return The context.
     */
    public AnalysisContext getContext() {
        return context;
    }
}
