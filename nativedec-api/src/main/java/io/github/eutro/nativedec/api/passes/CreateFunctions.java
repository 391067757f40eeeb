package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.FunctionNamer;
import io.github.eutro.nativedec.api.analysis.FunctionsGenerator;
import io.github.eutro.nativedec.api.stage.FunctionsStage;
import io.github.eutro.nativedec.api.stage.ProgramStage;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.Functions;
import io.github.eutro.nativedec.core.passes.IRPass;

/**
 * Partitions the program into functions and names them.
 */
public class CreateFunctions implements IRPass<ProgramStage, FunctionsStage> {
    private final FunctionsGenerator generator;

    public CreateFunctions(FunctionsGenerator generator) {
        this.generator = generator;
    }

    @Override
    public FunctionsStage run(ProgramStage stage) {
        stage.getContext().getLogToken().log("Creating functions.");
        Functions functions = generator.makeFunctions(stage.getProgram());
        FunctionNamer namer = new FunctionNamer(stage.getContext().getImage());
        for (Function function : functions.list()) {
            namer.name(function);
        }
        return new FunctionsStage(stage, functions);
    }
}
