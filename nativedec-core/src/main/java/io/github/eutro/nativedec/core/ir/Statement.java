package io.github.eutro.nativedec.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An instruction-level unit of the IR, composed of {@link Term}s.
 */
public abstract class Statement {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    /**
     * The kind of a statement.
     */
    public enum Kind {
        COMMENT,
        INLINE_ASSEMBLY,
        ASSIGNMENT,
        KILL,
        JUMP,
        CALL,
        RETURN,
    }

    private final int id = ID_COUNTER.getAndIncrement();
    private final Kind kind;
    @Nullable
    private BasicBlock basicBlock;

    protected Statement(Kind kind) {
        this.kind = kind;
    }

    /**
     * Get the unique handle of this statement. Handles are allocated in construction order.
     *
     * @return The handle.
     */
    public int getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the block this statement is in, if any.
     *
     * @return The block.
     */
    public @Nullable BasicBlock getBasicBlock() {
        return basicBlock;
    }

    void setBasicBlock(@Nullable BasicBlock basicBlock) {
        this.basicBlock = basicBlock;
    }

    /**
     * Get the top-level terms of this statement, in evaluation order.
     *
     * @return The terms.
     */
    public abstract List<Term> getTerms();

    /**
     * Take ownership of a read term.
     *
     * @param term The term.
     * @param <T>  The type of the term.
     * @return {@code term}.
     */
    protected <T extends Term> T read(T term) {
        term.fixAccess(Term.AccessType.READ, null);
        term.setStatementRecursively(this);
        return term;
    }

    /**
     * Take ownership of a written term.
     *
     * @param term   The term.
     * @param source The term whose value is written, if any.
     * @param <T>    The type of the term.
     * @return {@code term}.
     */
    protected <T extends Term> T write(T term, @Nullable Term source) {
        if (!(term instanceof MemoryLocationAccess) && !(term instanceof Dereference)) {
            throw new IllegalArgumentException("only memory accesses can be written: " + term);
        }
        term.fixAccess(Term.AccessType.WRITE, source);
        term.setStatementRecursively(this);
        return term;
    }
}
