package io.github.eutro.nativedec.core.passes;

/**
 * A pass to run on some part of the IR or on the artifacts derived from it,
 * which may modify them, or convert them to a different form.
 * <p>
 * A pass that only inspects or updates its input is an {@link InPlaceIRPass}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input to run it on.
     * @return The result, or null if the pass was interrupted before it could produce one.
     */
    B run(A a);
}
