package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An explicitly undefined value.
 */
public final class Undefined extends Term {
    public Undefined(int size) {
        super(Kind.UNDEFINED, size);
    }

    @Override
    public List<Term> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
