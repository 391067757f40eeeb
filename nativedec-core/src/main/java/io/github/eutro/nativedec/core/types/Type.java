package io.github.eutro.nativedec.core.types;

/**
 * The reconstructed type of a term.
 */
public final class Type {
    /**
     * What the value is used as.
     */
    public enum Kind {
        UNKNOWN,
        INTEGER,
        FLOAT,
        POINTER,
    }

    private final Kind kind;
    private final int size;

    public Type(Kind kind, int size) {
        this.kind = kind;
        this.size = size;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the size of values of this type.
     *
     * @return The size, in bits.
     */
    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + size;
    }
}
