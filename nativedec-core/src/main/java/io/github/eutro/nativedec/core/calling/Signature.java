package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.MemoryLocation;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reconstructed function signature: where its arguments are passed and where its result is returned.
 */
public final class Signature {
    private final String name;
    private final List<MemoryLocation> arguments;
    @Nullable
    private final MemoryLocation returnValue;

    /**
     * Construct a signature.
     *
     * @param name        The name of the callee.
     * @param arguments   The argument locations, in order.
     * @param returnValue The return value location, or null if the callee returns nothing.
     */
    public Signature(String name, List<MemoryLocation> arguments, @Nullable MemoryLocation returnValue) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.returnValue = returnValue;
    }

    public String getName() {
        return name;
    }

    public List<MemoryLocation> arguments() {
        return arguments;
    }

    public @Nullable MemoryLocation returnValue() {
        return returnValue;
    }

    @Override
    public String toString() {
        return (returnValue == null ? "void" : returnValue.toString()) + " " + name + arguments;
    }
}
