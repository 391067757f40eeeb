package io.github.eutro.nativedec.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Where a {@link Jump} goes: a computed address, a known block, or both.
 */
public final class JumpTarget {
    @Nullable
    private final Term address;
    @Nullable
    private final BasicBlock basicBlock;

    private JumpTarget(@Nullable Term address, @Nullable BasicBlock basicBlock) {
        this.address = address;
        this.basicBlock = basicBlock;
    }

    public static JumpTarget of(BasicBlock basicBlock) {
        return new JumpTarget(null, basicBlock);
    }

    public static JumpTarget of(Term address) {
        return new JumpTarget(address, null);
    }

    public static JumpTarget of(Term address, BasicBlock basicBlock) {
        return new JumpTarget(address, basicBlock);
    }

    public @Nullable Term getAddress() {
        return address;
    }

    public @Nullable BasicBlock getBasicBlock() {
        return basicBlock;
    }

    @Override
    public String toString() {
        if (basicBlock != null) return basicBlock.toTargetString();
        return String.valueOf(address);
    }
}
