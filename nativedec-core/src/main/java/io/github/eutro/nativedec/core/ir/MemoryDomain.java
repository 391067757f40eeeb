package io.github.eutro.nativedec.core.ir;

/**
 * Well-known domains of {@link MemoryLocation}s.
 * <p>
 * Domains from {@link #FIRST_REGISTER} upwards are registers, numbered by the architecture.
 */
public final class MemoryDomain {
    private MemoryDomain() {
    }

    /**
     * A location that could not be classified.
     */
    public static final int UNKNOWN = 0;
    /**
     * Addressable memory shared by the whole program.
     */
    public static final int MEMORY = 1;
    /**
     * The current function's stack frame.
     */
    public static final int STACK = 2;
    /**
     * The first register domain.
     */
    public static final int FIRST_REGISTER = 16;

    /**
     * Check whether the domain is a register domain.
     *
     * @param domain The domain.
     * @return Whether it denotes a register.
     */
    public static boolean isRegister(int domain) {
        return domain >= FIRST_REGISTER;
    }
}
