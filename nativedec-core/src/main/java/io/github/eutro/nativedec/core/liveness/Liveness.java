package io.github.eutro.nativedec.core.liveness;

import io.github.eutro.nativedec.core.ir.Term;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * The set of live terms of a function: the terms whose value may affect
 * the observable behaviour of the program.
 * <p>
 * Grows while the {@link LivenessAnalyzer} runs and is read-only once {@link #freeze() frozen}.
 */
public final class Liveness {
    private final Set<Term> liveTerms = Collections.newSetFromMap(new IdentityHashMap<>());
    private volatile boolean frozen;

    public boolean isLive(Term term) {
        return liveTerms.contains(term);
    }

    /**
     * Mark a term as live.
     *
     * @param term The term.
     * @return Whether the term was not already live.
     * @throws IllegalStateException If this liveness is frozen.
     */
    public boolean makeLive(Term term) {
        if (frozen) throw new IllegalStateException("liveness is frozen");
        return liveTerms.add(term);
    }

    /**
     * Get a read-only view of the live terms.
     *
     * @return The live terms.
     */
    public Set<Term> getLiveTerms() {
        return Collections.unmodifiableSet(liveTerms);
    }

    public int size() {
        return liveTerms.size();
    }

    /**
     * Make this liveness read-only.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
