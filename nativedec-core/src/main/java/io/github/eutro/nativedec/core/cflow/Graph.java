package io.github.eutro.nativedec.core.cflow;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The structured control-flow graph of a function: its basic nodes
 * and, once structural analysis is done, the root of its region tree.
 */
public final class Graph {
    private final List<Node> nodes;
    @Nullable
    private final Region root;

    public Graph(List<Node> nodes, @Nullable Region root) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.root = root;
    }

    /**
     * Get every node of the graph, regions included.
     *
     * @return The nodes.
     */
    public List<Node> getNodes() {
        return nodes;
    }

    public @Nullable Region getRoot() {
        return root;
    }
}
