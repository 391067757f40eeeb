package io.github.eutro.nativedec.core.arch;

import org.jetbrains.annotations.Nullable;

/**
 * Turns mangled symbol names into readable ones.
 */
@FunctionalInterface
public interface Demangler {
    /**
     * A demangler that never recognizes a name.
     */
    Demangler NONE = name -> null;

    /**
     * Demangle a symbol name.
     *
     * @param name The mangled name.
     * @return The demangled name, or null if the name is not mangled in a known scheme.
     */
    @Nullable String demangle(String name);
}
