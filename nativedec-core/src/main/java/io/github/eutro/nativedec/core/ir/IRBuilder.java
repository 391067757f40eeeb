package io.github.eutro.nativedec.core.ir;

/**
 * An IR builder, which encapsulates a position in a function
 * where statements are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct a builder, inserting into a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Insert a statement at the end of the current block.
     *
     * @param statement The statement.
     * @param <S>       The type of the statement.
     * @return The statement.
     */
    public <S extends Statement> S insert(S statement) {
        return bb.addStatement(statement);
    }

    /**
     * Insert {@code left = right}.
     *
     * @param left  The written term.
     * @param right The value.
     * @return The assignment.
     */
    public Assignment assign(Term left, Term right) {
        return insert(new Assignment(left, right));
    }

    /**
     * Insert an unconditional jump to a block.
     *
     * @param target The block.
     * @return The jump.
     */
    public Jump jumpTo(BasicBlock target) {
        return insert(new Jump(JumpTarget.of(target)));
    }

    /**
     * Insert a conditional jump.
     *
     * @param condition  The condition.
     * @param thenTarget The target if it holds.
     * @param elseTarget The target otherwise.
     * @return The jump.
     */
    public Jump branch(Term condition, JumpTarget thenTarget, JumpTarget elseTarget) {
        return insert(new Jump(condition, thenTarget, elseTarget));
    }

    public Call call(Term target) {
        return insert(new Call(target));
    }

    public Return ret() {
        return insert(new Return());
    }
}
