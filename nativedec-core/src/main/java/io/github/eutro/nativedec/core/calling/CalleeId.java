package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.Function;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Identifies a callee: by its entry address where there is one, by its {@link Function} otherwise.
 */
public final class CalleeId {
    @Nullable
    private final Long entryAddress;
    @Nullable
    private final Function function;

    private CalleeId(@Nullable Long entryAddress, @Nullable Function function) {
        this.entryAddress = entryAddress;
        this.function = function;
    }

    public static CalleeId ofAddress(long entryAddress) {
        return new CalleeId(entryAddress, null);
    }

    public static CalleeId ofFunction(Function function) {
        return new CalleeId(null, Objects.requireNonNull(function));
    }

    public @Nullable Long getEntryAddress() {
        return entryAddress;
    }

    public @Nullable Function getFunction() {
        return function;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalleeId)) return false;
        CalleeId that = (CalleeId) o;
        return Objects.equals(entryAddress, that.entryAddress) && function == that.function;
    }

    @Override
    public int hashCode() {
        return entryAddress != null
                ? Long.hashCode(entryAddress)
                : System.identityHashCode(function);
    }

    @Override
    public String toString() {
        if (entryAddress != null) return String.format("callee@%x", entryAddress);
        return "callee(" + (function == null ? null : function.getName()) + ")";
    }
}
