package io.github.eutro.nativedec.core.ir;

import java.util.Arrays;
import java.util.List;

/**
 * {@code left = right}. The left term is written with the value of the right term.
 */
public final class Assignment extends Statement {
    private final Term left;
    private final Term right;

    public Assignment(Term left, Term right) {
        super(Kind.ASSIGNMENT);
        if (left.getSize() != right.getSize()) {
            throw new IllegalArgumentException("assignment of a " + right.getSize()
                    + "-bit value to a " + left.getSize() + "-bit term");
        }
        this.right = read(right);
        this.left = write(left, right);
    }

    public Term getLeft() {
        return left;
    }

    public Term getRight() {
        return right;
    }

    @Override
    public List<Term> getTerms() {
        return Arrays.asList(right, left);
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
