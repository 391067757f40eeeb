package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.stage.TreeStage;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.misc.CensusVisitor;
import io.github.eutro.nativedec.core.likec.TreeNode;
import io.github.eutro.nativedec.core.passes.InPlaceIRPass;

/**
 * Checks that every statement and term the generated tree refers to is part of the program.
 * <p>
 * Throws {@link IllegalStateException} if a tree node refers to anything outside every function.
 */
public class CheckTree implements InPlaceIRPass<TreeStage> {
    /**
     * A singleton instance of this pass.
     */
    public static final CheckTree INSTANCE = new CheckTree();

    @Override
    public void runInPlace(TreeStage stage) {
        stage.getContext().getLogToken().log("Checking AST.");
        CensusVisitor census = new CensusVisitor(stage.getHooks(), stage.getSignatures());
        for (Function function : stage.getFunctions().list()) {
            census.visit(function);
        }
        for (TreeNode node : stage.getTree().nodes()) {
            if (node.getStatement() != null && !census.contains(node.getStatement())) {
                throw new IllegalStateException("tree node " + node.getLabel()
                        + " refers to a statement outside the program: " + node.getStatement());
            }
            if (node.getTerm() != null && !census.contains(node.getTerm())) {
                throw new IllegalStateException("tree node " + node.getLabel()
                        + " refers to a term outside the program: " + node.getTerm());
            }
        }
    }
}
