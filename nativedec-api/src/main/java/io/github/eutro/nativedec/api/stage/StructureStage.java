package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.cflow.Graphs;

/**
 * Every function has a structured control-flow graph.
 */
public class StructureStage extends VariablesStage {
    private final Graphs graphs;

    public StructureStage(VariablesStage previous, Graphs graphs) {
        super(previous, previous.getVariables());
        this.graphs = graphs;
    }

    public Graphs getGraphs() {
        return graphs;
    }
}
