package io.github.eutro.nativedec.core.cflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A structured region of the control-flow graph, grouping its sub-nodes.
 */
public class Region extends Node {
    private final RegionKind kind;
    private final List<Node> nodes;

    public Region(RegionKind kind, List<Node> nodes) {
        this.kind = kind;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public RegionKind getKind() {
        return kind;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return kind + "" + nodes;
    }
}
