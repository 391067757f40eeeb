package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.api.analysis.ProgramGenerator;
import io.github.eutro.nativedec.api.stage.ProgramStage;
import io.github.eutro.nativedec.core.ir.Program;
import io.github.eutro.nativedec.core.passes.IRPass;

/**
 * Lifts the image of a context into the IR.
 */
public class CreateProgram implements IRPass<AnalysisContext, ProgramStage> {
    private final ProgramGenerator generator;

    public CreateProgram(ProgramGenerator generator) {
        this.generator = generator;
    }

    @Override
    public ProgramStage run(AnalysisContext context) {
        context.getLogToken().log("Creating intermediate representation of the program.");
        Program program = generator.generate(context.getImage(), context.getCancellationToken());
        return new ProgramStage(context, program);
    }
}
