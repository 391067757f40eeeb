package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.MemoryLocationAccess;
import io.github.eutro.nativedec.core.ir.Return;
import io.github.eutro.nativedec.core.ir.Term;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Models a return under a known calling convention, materializing the read of the returned value.
 */
public final class ReturnHook {
    private final Return ret;
    private final Convention convention;
    private final Map<MemoryLocation, Term> returnValueTerms = new ConcurrentHashMap<>();

    ReturnHook(Return ret, Convention convention) {
        this.ret = ret;
        this.convention = convention;
    }

    public Return getReturn() {
        return ret;
    }

    public Convention getConvention() {
        return convention;
    }

    /**
     * Get the term reading the returned value. Always the same term for the same location.
     *
     * @param memoryLocation The return value location.
     * @return The read term.
     */
    public Term getReturnValueTerm(MemoryLocation memoryLocation) {
        return returnValueTerms.computeIfAbsent(memoryLocation,
                ml -> Term.bindDetached(new MemoryLocationAccess(ml), ret));
    }
}
