package io.github.eutro.nativedec.core.cflow;

/**
 * A node of a function's structured control-flow {@link Graph}.
 */
public abstract class Node {
    /**
     * Whether this node wraps a single basic block.
     *
     * @return True for {@link BasicNode}s.
     */
    public boolean isBasic() {
        return false;
    }
}
