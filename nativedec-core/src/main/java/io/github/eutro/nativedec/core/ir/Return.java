package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * A return from the current function.
 * <p>
 * The returned value is materialized by the
 * {@link io.github.eutro.nativedec.core.calling.ReturnHook return hook}.
 */
public final class Return extends Statement {
    public Return() {
        super(Kind.RETURN);
    }

    @Override
    public List<Term> getTerms() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "return";
    }
}
