package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.likec.Tree;

/**
 * The output syntax tree has been generated.
 */
public class TreeStage extends TypesStage {
    private final Tree tree;

    public TreeStage(TypesStage previous, Tree tree) {
        super(previous, previous.getTypes());
        this.tree = tree;
    }

    public Tree getTree() {
        return tree;
    }
}
