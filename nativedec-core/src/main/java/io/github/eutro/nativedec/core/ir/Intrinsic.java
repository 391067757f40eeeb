package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * A value with special meaning that the lifter could not express otherwise,
 * such as the result of an instruction it does not model.
 */
public final class Intrinsic extends Term {
    /**
     * What an intrinsic stands for.
     */
    public enum IntrinsicKind {
        UNKNOWN,
        UNDEFINED,
        ZERO_STACK_OFFSET,
        RETURN_ADDRESS,
    }

    private final IntrinsicKind intrinsicKind;

    public Intrinsic(IntrinsicKind intrinsicKind, int size) {
        super(Kind.INTRINSIC, size);
        this.intrinsicKind = intrinsicKind;
    }

    public IntrinsicKind getIntrinsicKind() {
        return intrinsicKind;
    }

    @Override
    public List<Term> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "intrinsic(" + intrinsicKind + ")";
    }
}
