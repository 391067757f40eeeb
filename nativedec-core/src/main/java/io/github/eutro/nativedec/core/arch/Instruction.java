package io.github.eutro.nativedec.core.arch;

/**
 * A decoded machine instruction, as far as the analyses are concerned.
 */
public final class Instruction {
    private final long address;
    private final int size;
    private final String text;

    public Instruction(long address, int size, String text) {
        if (size <= 0) throw new IllegalArgumentException("size must be positive: " + size);
        this.address = address;
        this.size = size;
        this.text = text;
    }

    public long getAddress() {
        return address;
    }

    public int getSize() {
        return size;
    }

    public long getEndAddress() {
        return address + size;
    }

    /**
     * Get the disassembled text of the instruction.
     *
     * @return The text.
     */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return String.format("%x: %s", address, text);
    }
}
