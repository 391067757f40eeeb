package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.core.ir.Program;

/**
 * The lifted program exists.
 */
public class ProgramStage extends Stage {
    private final Program program;

    public ProgramStage(AnalysisContext context, Program program) {
        super(context);
        this.program = program;
    }

    public Program getProgram() {
        return program;
    }
}
