package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.stage.CompletedStage;
import io.github.eutro.nativedec.api.stage.TreeStage;
import io.github.eutro.nativedec.core.ir.misc.TermToFunction;
import io.github.eutro.nativedec.core.passes.IRPass;

public class ComputeTermToFunction implements IRPass<TreeStage, CompletedStage> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeTermToFunction INSTANCE = new ComputeTermToFunction();

    @Override
    public CompletedStage run(TreeStage stage) {
        stage.getContext().getLogToken().log("Computing term to function mapping.");
        TermToFunction termToFunction = new TermToFunction(stage.getFunctions(), stage.getHooks(), stage.getSignatures());
        return new CompletedStage(stage, termToFunction);
    }
}
