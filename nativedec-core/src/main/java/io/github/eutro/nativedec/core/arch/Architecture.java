package io.github.eutro.nativedec.core.arch;

import io.github.eutro.nativedec.core.ir.MemoryDomain;
import io.github.eutro.nativedec.core.ir.MemoryLocation;

/**
 * What the analyses need to know about the target architecture.
 */
public interface Architecture {
    /**
     * An architecture with no registers of note, whose only global memory is {@link MemoryDomain#MEMORY}.
     */
    Architecture GENERIC = () -> "generic";

    String getName();

    /**
     * Check whether writes to the location outlive the function that makes them,
     * being visible to the rest of the program or to the caller.
     *
     * @param memoryLocation The location.
     * @return Whether the location is global.
     */
    default boolean isGlobalMemory(MemoryLocation memoryLocation) {
        return memoryLocation.getDomain() == MemoryDomain.MEMORY;
    }
}
