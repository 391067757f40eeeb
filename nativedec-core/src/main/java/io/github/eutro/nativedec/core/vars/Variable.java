package io.github.eutro.nativedec.core.vars;

import io.github.eutro.nativedec.core.ir.MemoryLocation;

/**
 * A reconstructed variable: a memory location, local to a function or global to the program.
 */
public final class Variable {
    private final MemoryLocation memoryLocation;
    private final boolean global;

    public Variable(MemoryLocation memoryLocation, boolean global) {
        this.memoryLocation = memoryLocation;
        this.global = global;
    }

    public MemoryLocation getMemoryLocation() {
        return memoryLocation;
    }

    public boolean isGlobal() {
        return global;
    }

    @Override
    public String toString() {
        return (global ? "global " : "local ") + memoryLocation;
    }
}
