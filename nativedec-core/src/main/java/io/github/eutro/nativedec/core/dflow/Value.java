package io.github.eutro.nativedec.core.dflow;

/**
 * What dataflow analysis knows about the value of a term.
 */
public final class Value {
    private static final Value UNKNOWN = new Value(false, 0);

    private final boolean concrete;
    private final long constant;

    private Value(boolean concrete, long constant) {
        this.concrete = concrete;
        this.constant = constant;
    }

    /**
     * A value nothing is known about.
     *
     * @return The value.
     */
    public static Value unknown() {
        return UNKNOWN;
    }

    /**
     * A fully known constant value.
     *
     * @param constant The constant.
     * @return The value.
     */
    public static Value concrete(long constant) {
        return new Value(true, constant);
    }

    /**
     * Whether every bit of the value is known.
     *
     * @return Whether the value is a known constant.
     */
    public boolean isConcrete() {
        return concrete;
    }

    public long getConstant() {
        if (!concrete) throw new IllegalStateException("value is not concrete");
        return constant;
    }

    @Override
    public String toString() {
        return concrete ? "0x" + Long.toHexString(constant) : "?";
    }
}
