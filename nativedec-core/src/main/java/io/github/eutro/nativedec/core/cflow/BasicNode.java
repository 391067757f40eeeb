package io.github.eutro.nativedec.core.cflow;

import io.github.eutro.nativedec.core.ir.BasicBlock;

/**
 * A leaf of the control-flow graph, wrapping one basic block.
 */
public final class BasicNode extends Node {
    private final BasicBlock basicBlock;

    public BasicNode(BasicBlock basicBlock) {
        this.basicBlock = basicBlock;
    }

    public BasicBlock basicBlock() {
        return basicBlock;
    }

    @Override
    public boolean isBasic() {
        return true;
    }

    @Override
    public String toString() {
        return "node" + basicBlock.toTargetString();
    }
}
