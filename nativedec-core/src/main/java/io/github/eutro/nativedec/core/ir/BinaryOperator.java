package io.github.eutro.nativedec.core.ir;

import java.util.Arrays;
import java.util.List;

/**
 * An operator applied to two operands.
 */
public final class BinaryOperator extends Term {
    public enum Op {
        AND,
        OR,
        XOR,
        SHL,
        SHR,
        SAR,
        ADD,
        SUB,
        MUL,
        SIGNED_DIV,
        SIGNED_REM,
        UNSIGNED_DIV,
        UNSIGNED_REM,
        EQUAL,
        SIGNED_LESS,
        SIGNED_LESS_OR_EQUAL,
        UNSIGNED_LESS,
        UNSIGNED_LESS_OR_EQUAL,
    }

    private final Op op;
    private final Term left;
    private final Term right;

    public BinaryOperator(Op op, Term left, Term right, int size) {
        super(Kind.BINARY_OPERATOR, size);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public Op getOp() {
        return op;
    }

    public Term getLeft() {
        return left;
    }

    public Term getRight() {
        return right;
    }

    @Override
    public List<Term> getChildren() {
        return Arrays.asList(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op + " " + right + ")";
    }
}
