package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.vars.Variables;

/**
 * Variables have been reconstructed.
 */
public class VariablesStage extends DataflowStage {
    private final Variables variables;

    public VariablesStage(DataflowStage previous, Variables variables) {
        super(previous, previous.getHooks(), previous.getDataflows());
        this.variables = variables;
    }

    public Variables getVariables() {
        return variables;
    }
}
