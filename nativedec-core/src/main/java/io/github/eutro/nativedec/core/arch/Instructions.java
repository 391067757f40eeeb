package io.github.eutro.nativedec.core.arch;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.TreeMap;

/**
 * The disassembled instructions of an image, ordered by address.
 */
public final class Instructions {
    private final TreeMap<Long, Instruction> byAddress = new TreeMap<>();

    /**
     * Add an instruction, replacing one at the same address.
     *
     * @param instruction The instruction.
     */
    public void add(Instruction instruction) {
        byAddress.put(instruction.getAddress(), instruction);
    }

    public @Nullable Instruction get(long address) {
        return byAddress.get(address);
    }

    public Collection<Instruction> all() {
        return Collections.unmodifiableCollection(byAddress.values());
    }

    public boolean isEmpty() {
        return byAddress.isEmpty();
    }
}
