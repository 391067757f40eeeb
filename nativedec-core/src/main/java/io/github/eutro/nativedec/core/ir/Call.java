package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * A call to the function at a computed address.
 * <p>
 * Arguments are not part of the statement. They are materialized by the
 * {@link io.github.eutro.nativedec.core.calling.CallHook call hook} once the
 * callee's calling convention and signature are known.
 */
public final class Call extends Statement {
    private final Term target;

    public Call(Term target) {
        super(Kind.CALL);
        this.target = read(target);
    }

    public Term getTarget() {
        return target;
    }

    @Override
    public List<Term> getTerms() {
        return Collections.singletonList(target);
    }

    @Override
    public String toString() {
        return "call " + target;
    }
}
