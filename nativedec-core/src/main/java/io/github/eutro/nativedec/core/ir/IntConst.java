package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An integer constant.
 */
public final class IntConst extends Term {
    private final long value;

    public IntConst(long value, int size) {
        super(Kind.INT_CONST, size);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public List<Term> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(value);
    }
}
