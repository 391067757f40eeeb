package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An operator applied to a single operand.
 */
public final class UnaryOperator extends Term {
    public enum Op {
        NOT,
        NEGATION,
        SIGN_EXTEND,
        ZERO_EXTEND,
        TRUNCATE,
    }

    private final Op op;
    private final Term operand;

    public UnaryOperator(Op op, Term operand, int size) {
        super(Kind.UNARY_OPERATOR, size);
        this.op = op;
        this.operand = operand;
    }

    public Op getOp() {
        return op;
    }

    public Term getOperand() {
        return operand;
    }

    @Override
    public List<Term> getChildren() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
        return op + "(" + operand + ")";
    }
}
