package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.analysis.CodeGenerator;
import io.github.eutro.nativedec.api.stage.TreeStage;
import io.github.eutro.nativedec.api.stage.TypesStage;
import io.github.eutro.nativedec.core.passes.IRPass;

public class GenerateTree implements IRPass<TypesStage, TreeStage> {
    private final CodeGenerator generator;

    public GenerateTree(CodeGenerator generator) {
        this.generator = generator;
    }

    @Override
    public TreeStage run(TypesStage stage) {
        stage.getContext().getLogToken().log("Generating AST.");
        return new TreeStage(stage, generator.generate(stage));
    }
}
