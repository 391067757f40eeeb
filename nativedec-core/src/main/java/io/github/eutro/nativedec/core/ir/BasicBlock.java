package io.github.eutro.nativedec.core.ir;

import io.github.eutro.nativedec.core.util.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block, a list of {@link Statement}s executed in sequence,
 * optionally ending with a {@link Jump}.
 */
public final class BasicBlock {
    @Nullable
    private final Long address;
    @Nullable
    private Function function;
    private final TrackedList<Statement> statements = new TrackedList<Statement>(new ArrayList<>()) {
        @Override
        protected void onAdded(Statement elt) {
            if (elt.getBasicBlock() != null) {
                throw new IllegalArgumentException("statement " + elt + " is already in a block");
            }
            elt.setBasicBlock(BasicBlock.this);
        }

        @Override
        protected void onRemoved(Statement elt) {
            elt.setBasicBlock(null);
        }
    };

    /**
     * Construct a basic block.
     *
     * @param address The address of the first instruction of the block, if it has one.
     */
    public BasicBlock(@Nullable Long address) {
        this.address = address;
    }

    public @Nullable Long getAddress() {
        return address;
    }

    /**
     * Get the list of statements in this block. Statements added to the list
     * are owned by this block.
     *
     * @return The statements.
     */
    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * Add a statement to the end of this block.
     *
     * @param statement The statement.
     * @param <S>       The type of the statement.
     * @return The statement.
     */
    public <S extends Statement> S addStatement(S statement) {
        statements.add(statement);
        return statement;
    }

    /**
     * Get the jump terminating this block, if any.
     *
     * @return The jump.
     */
    public @Nullable Jump getJump() {
        if (statements.isEmpty()) return null;
        Statement last = statements.get(statements.size() - 1);
        return last instanceof Jump ? (Jump) last : null;
    }

    /**
     * Get the function this block is in, if any.
     *
     * @return The function.
     */
    public @Nullable Function getFunction() {
        return function;
    }

    void setFunction(@Nullable Function function) {
        this.function = function;
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        if (address != null) return String.format("@%x", address);
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Statement statement : statements) {
            sb.append(' ').append(statement).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
