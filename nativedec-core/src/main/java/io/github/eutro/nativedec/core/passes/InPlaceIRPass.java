package io.github.eutro.nativedec.core.passes;

/**
 * An IR pass whose result is its input.
 *
 * @param <T> The type of the input this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The input to run this pass on.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }
}
