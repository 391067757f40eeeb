package io.github.eutro.nativedec.core.arch;

import org.jetbrains.annotations.Nullable;

/**
 * The executable being decompiled: its architecture, its symbols and its instructions.
 */
public interface Image {
    Architecture getArchitecture();

    /**
     * Look up the name of the symbol at an address.
     *
     * @param address The address.
     * @return The name, or null if there is no symbol there.
     */
    @Nullable String getName(long address);

    default Demangler getDemangler() {
        return Demangler.NONE;
    }

    Instructions getInstructions();
}
