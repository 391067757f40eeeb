package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * Marks the value of a term as no longer defined, without writing a new one.
 */
public final class Kill extends Statement {
    private final Term term;

    public Kill(Term term) {
        super(Kind.KILL);
        this.term = write(term, null);
    }

    public Term getTerm() {
        return term;
    }

    @Override
    public List<Term> getTerms() {
        return Collections.singletonList(term);
    }

    @Override
    public String toString() {
        return "kill " + term;
    }
}
