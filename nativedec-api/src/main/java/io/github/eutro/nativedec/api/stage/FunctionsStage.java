package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.ir.Functions;

/**
 * The program has been partitioned into named functions.
 */
public class FunctionsStage extends ProgramStage {
    private final Functions functions;

    public FunctionsStage(ProgramStage previous, Functions functions) {
        super(previous.getContext(), previous.getProgram());
        this.functions = functions;
    }

    public Functions getFunctions() {
        return functions;
    }
}
