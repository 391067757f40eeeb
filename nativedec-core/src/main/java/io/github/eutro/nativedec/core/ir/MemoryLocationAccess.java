package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An access to a statically known {@link MemoryLocation}, such as a register.
 */
public final class MemoryLocationAccess extends Term {
    private final MemoryLocation memoryLocation;

    public MemoryLocationAccess(MemoryLocation memoryLocation) {
        super(Kind.MEMORY_LOCATION_ACCESS, (int) memoryLocation.getSize());
        this.memoryLocation = memoryLocation;
    }

    public MemoryLocation getMemoryLocation() {
        return memoryLocation;
    }

    @Override
    public List<Term> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return memoryLocation.toString();
    }
}
