package io.github.eutro.nativedec.core.ir;

import java.util.Objects;

/**
 * An abstract storage cell: a range of bits at an offset within a {@link MemoryDomain domain}.
 * <p>
 * Unlike terms, memory locations are values, compared structurally.
 */
public final class MemoryLocation {
    private final int domain;
    private final long offset;
    private final long size;

    /**
     * Construct a memory location.
     *
     * @param domain The domain.
     * @param offset The offset into the domain, in bits.
     * @param size   The size, in bits.
     */
    public MemoryLocation(int domain, long offset, long size) {
        if (size <= 0) throw new IllegalArgumentException("size must be positive: " + size);
        this.domain = domain;
        this.offset = offset;
        this.size = size;
    }

    public int getDomain() {
        return domain;
    }

    public long getOffset() {
        return offset;
    }

    public long getSize() {
        return size;
    }

    public long getEndOffset() {
        return offset + size;
    }

    /**
     * Check whether the two locations share at least one bit.
     *
     * @param other The other location.
     * @return Whether they overlap.
     */
    public boolean overlaps(MemoryLocation other) {
        return domain == other.domain
                && offset < other.getEndOffset()
                && other.offset < getEndOffset();
    }

    /**
     * Check whether every bit of {@code other} is also in this location.
     *
     * @param other The other location.
     * @return Whether this covers it.
     */
    public boolean covers(MemoryLocation other) {
        return domain == other.domain
                && offset <= other.offset
                && other.getEndOffset() <= getEndOffset();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemoryLocation that = (MemoryLocation) o;
        return domain == that.domain && offset == that.offset && size == that.size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, offset, size);
    }

    @Override
    public String toString() {
        return "mem(" + domain + ", " + offset + ", " + size + ")";
    }
}
