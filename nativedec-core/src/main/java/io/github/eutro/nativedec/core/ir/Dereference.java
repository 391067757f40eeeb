package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An access to memory at a computed address.
 * <p>
 * The address term is always read. Which memory location the access
 * touches is decided by dataflow analysis, and may stay unknown.
 */
public final class Dereference extends Term {
    private final Term address;
    private final int domain;

    /**
     * Construct a dereference.
     *
     * @param address The address term.
     * @param domain  The {@link MemoryDomain} the address points into.
     * @param size    The size of the accessed value, in bits.
     */
    public Dereference(Term address, int domain, int size) {
        super(Kind.DEREFERENCE, size);
        this.address = address;
        this.domain = domain;
    }

    public Term getAddress() {
        return address;
    }

    public int getDomain() {
        return domain;
    }

    @Override
    public List<Term> getChildren() {
        return Collections.singletonList(address);
    }

    @Override
    public String toString() {
        return "*(" + address + ")";
    }
}
