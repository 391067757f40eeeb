package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.Call;
import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.MemoryLocationAccess;
import io.github.eutro.nativedec.core.ir.Term;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Models a call site under a known calling convention.
 * <p>
 * The hook materializes one read term per argument location, so that dataflow
 * analysis can compute what reaches each argument of the call.
 */
public final class CallHook {
    private final Call call;
    private final Convention convention;
    private final Map<MemoryLocation, Term> argumentTerms = new ConcurrentHashMap<>();

    CallHook(Call call, Convention convention) {
        this.call = call;
        this.convention = convention;
    }

    public Call getCall() {
        return call;
    }

    public Convention getConvention() {
        return convention;
    }

    /**
     * Get the term reading an argument of the call. Always the same term for the same location.
     *
     * @param memoryLocation The argument location.
     * @return The read term.
     */
    public Term getArgumentTerm(MemoryLocation memoryLocation) {
        return argumentTerms.computeIfAbsent(memoryLocation,
                ml -> Term.bindDetached(new MemoryLocationAccess(ml), call));
    }
}
