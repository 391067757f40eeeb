package io.github.eutro.nativedec.api;

/**
 * Options of a {@link Decompiler}.
 * <p>
 * Use {@link #builder()} to construct, or {@link #defaults()}.
 */
public final class DecompilerOptions {
    /**
     * Whether {@link #isPreferConstants()} is on by default.
     */
    public static final boolean PREFER_CONSTANTS = System.getenv("NATIVEDEC_PREFER_CONSTANTS") != null;
    /**
     * Whether {@link #isCheckTree()} is on by default.
     */
    public static final boolean TREE_CHECKS = System.getenv("NATIVEDEC_TREE_CHECKS") != null;

    private final int parallelism;
    private final boolean preferConstants;
    private final boolean checkTree;

    private DecompilerOptions(Builder builder) {
        parallelism = builder.parallelism;
        preferConstants = builder.preferConstants;
        checkTree = builder.checkTree;
    }

    public static DecompilerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the number of functions analysed at once by per-function passes.
     *
     * @return The parallelism, 1 if functions are analysed on the calling thread.
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * Get whether liveness analysis stops at reads of values known to be constant,
     * leaving the computations of those values dead.
     *
     * @return Whether constants are preferred to the expressions computing them.
     */
    public boolean isPreferConstants() {
        return preferConstants;
    }

    /**
     * Get whether the generated tree is checked against the IR before decompilation completes.
     *
     * @return Whether tree checks are on.
     */
    public boolean isCheckTree() {
        return checkTree;
    }

    /**
     * A builder for {@link DecompilerOptions}.
     */
    public static class Builder {
        private int parallelism = 1;
        private boolean preferConstants = PREFER_CONSTANTS;
        private boolean checkTree = TREE_CHECKS;

        public Builder setParallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder setPreferConstants(boolean preferConstants) {
            this.preferConstants = preferConstants;
            return this;
        }

        public Builder setCheckTree(boolean checkTree) {
            this.checkTree = checkTree;
            return this;
        }

        public DecompilerOptions build() {
            return new DecompilerOptions(this);
        }
    }
}
