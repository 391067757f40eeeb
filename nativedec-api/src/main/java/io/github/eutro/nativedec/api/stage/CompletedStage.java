package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.ir.misc.TermToFunction;

/**
 * Decompilation is complete, and terms can be mapped back to their functions.
 */
public final class CompletedStage extends TreeStage {
    private final TermToFunction termToFunction;

    public CompletedStage(TreeStage previous, TermToFunction termToFunction) {
        super(previous, previous.getTree());
        this.termToFunction = termToFunction;
    }

    public TermToFunction getTermToFunction() {
        return termToFunction;
    }
}
