package io.github.eutro.nativedec.core.ir;

import java.util.Arrays;
import java.util.List;

/**
 * A value that is the preferred term if any definition of it reaches
 * this point, and the default term otherwise.
 */
public final class Choice extends Term {
    private final Term preferredTerm;
    private final Term defaultTerm;

    public Choice(Term preferredTerm, Term defaultTerm) {
        super(Kind.CHOICE, preferredTerm.getSize());
        if (preferredTerm.getSize() != defaultTerm.getSize()) {
            throw new IllegalArgumentException("choice alternatives differ in size");
        }
        this.preferredTerm = preferredTerm;
        this.defaultTerm = defaultTerm;
    }

    public Term getPreferredTerm() {
        return preferredTerm;
    }

    public Term getDefaultTerm() {
        return defaultTerm;
    }

    @Override
    public List<Term> getChildren() {
        return Arrays.asList(preferredTerm, defaultTerm);
    }

    @Override
    public String toString() {
        return "choice(" + preferredTerm + ", " + defaultTerm + ")";
    }
}
