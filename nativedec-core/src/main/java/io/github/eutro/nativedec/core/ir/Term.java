package io.github.eutro.nativedec.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A node of the IR that produces or consumes a value.
 * <p>
 * Every term is either {@link AccessType#READ read} or {@link AccessType#WRITE written}.
 * Terms are read unless they are the left-hand side of an {@link Assignment}
 * or the subject of a {@link Kill}.
 */
public abstract class Term {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    /**
     * The kind of a term.
     */
    public enum Kind {
        INT_CONST,
        INTRINSIC,
        UNDEFINED,
        MEMORY_LOCATION_ACCESS,
        DEREFERENCE,
        UNARY_OPERATOR,
        BINARY_OPERATOR,
        CHOICE,
    }

    /**
     * How a term accesses its value.
     */
    public enum AccessType {
        READ,
        WRITE,
    }

    private final int id = ID_COUNTER.getAndIncrement();
    private final Kind kind;
    private final int size;
    private AccessType accessType = AccessType.READ;
    private boolean accessFixed = false;
    @Nullable
    private Term source;
    @Nullable
    private Statement statement;

    /**
     * Construct a term.
     *
     * @param kind The kind of the term.
     * @param size The size of the term's value, in bits.
     */
    protected Term(Kind kind, int size) {
        if (size <= 0) throw new IllegalArgumentException("size must be positive: " + size);
        this.kind = kind;
        this.size = size;
    }

    /**
     * Get the unique handle of this term. Handles are allocated in construction order.
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
     * Get the size of this term's value.
     *
     * @return The size, in bits.
     */
    public int getSize() {
        return size;
    }

    public AccessType getAccessType() {
        return accessType;
    }

    public boolean isRead() {
        return accessType == AccessType.READ;
    }

    public boolean isWrite() {
        return accessType == AccessType.WRITE;
    }

    /**
     * Get the term whose value this term is assigned, if this is the written
     * side of an {@link Assignment}.
     *
     * @return The source term, or null.
     */
    public @Nullable Term getSource() {
        return source;
    }

    /**
     * Get the statement this term is part of, if any.
     *
     * @return The statement.
     */
    public @Nullable Statement getStatement() {
        return statement;
    }

    /**
     * Get the immediate subterms of this term.
     *
     * @return The subterms.
     */
    public abstract List<Term> getChildren();

    void fixAccess(AccessType accessType, @Nullable Term source) {
        if (accessFixed) {
            throw new IllegalStateException("term " + this + " already belongs to a statement");
        }
        this.accessType = accessType;
        this.source = source;
        accessFixed = true;
    }

    void setStatementRecursively(Statement statement) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Term term = stack.pop();
            term.statement = statement;
            for (Term child : term.getChildren()) {
                child.fixAccess(AccessType.READ, null);
                stack.push(child);
            }
        }
    }

    /**
     * Bind a term that was materialized outside any statement, such as
     * the argument terms created by call hooks, to the statement it describes.
     *
     * @param term      The term.
     * @param statement The statement.
     * @param <T>       The type of the term.
     * @return {@code term}.
     */
    public static <T extends Term> T bindDetached(T term, Statement statement) {
        term.fixAccess(AccessType.READ, null);
        term.setStatementRecursively(statement);
        return term;
    }
}
