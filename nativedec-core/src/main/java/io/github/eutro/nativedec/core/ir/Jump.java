package io.github.eutro.nativedec.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A conditional or unconditional jump. Must be the last statement of its block.
 */
public final class Jump extends Statement {
    @Nullable
    private final Term condition;
    private final JumpTarget thenTarget;
    @Nullable
    private final JumpTarget elseTarget;

    /**
     * Construct an unconditional jump.
     *
     * @param target The target.
     */
    public Jump(JumpTarget target) {
        this(null, target, null);
    }

    /**
     * Construct a conditional jump.
     *
     * @param condition  The condition, jumps to {@code thenTarget} if it is non-zero.
     * @param thenTarget The target if the condition holds.
     * @param elseTarget The target otherwise.
     */
    public Jump(@Nullable Term condition, JumpTarget thenTarget, @Nullable JumpTarget elseTarget) {
        super(Kind.JUMP);
        if ((condition == null) != (elseTarget == null)) {
            throw new IllegalArgumentException("a conditional jump needs both a condition and an else target");
        }
        this.condition = condition == null ? null : read(condition);
        this.thenTarget = thenTarget;
        this.elseTarget = elseTarget;
        if (thenTarget.getAddress() != null) read(thenTarget.getAddress());
        if (elseTarget != null && elseTarget.getAddress() != null) read(elseTarget.getAddress());
    }

    public boolean isConditional() {
        return condition != null;
    }

    public @Nullable Term getCondition() {
        return condition;
    }

    public JumpTarget getThenTarget() {
        return thenTarget;
    }

    public @Nullable JumpTarget getElseTarget() {
        return elseTarget;
    }

    @Override
    public List<Term> getTerms() {
        if (condition == null && thenTarget.getAddress() == null) return Collections.emptyList();
        List<Term> terms = new ArrayList<>(3);
        if (condition != null) terms.add(condition);
        if (thenTarget.getAddress() != null) terms.add(thenTarget.getAddress());
        if (elseTarget != null && elseTarget.getAddress() != null) terms.add(elseTarget.getAddress());
        return terms;
    }

    @Override
    public String toString() {
        if (condition == null) return "goto " + thenTarget;
        return "if " + condition + " goto " + thenTarget + " else goto " + elseTarget;
    }
}
