package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.core.calling.ConventionDetector;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.cflow.BasicNode;
import io.github.eutro.nativedec.core.cflow.Graph;
import io.github.eutro.nativedec.core.cflow.Node;
import io.github.eutro.nativedec.core.ir.BasicBlock;
import io.github.eutro.nativedec.core.likec.Tree;
import io.github.eutro.nativedec.core.types.Types;
import io.github.eutro.nativedec.core.vars.Variables;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The external analyzers the decompiler delegates to.
 * <p>
 * Use {@link #builder()} to construct. Only the {@link ProgramGenerator} and
 * {@link FunctionsGenerator} are required, the others default to analyzers
 * that produce empty artifacts.
 */
public class Collaborators {
    private final ProgramGenerator programGenerator;
    private final FunctionsGenerator functionsGenerator;
    private final DataflowAnalyzer dataflowAnalyzer;
    private final SignatureAnalyzer signatureAnalyzer;
    private final VariableAnalyzer variableAnalyzer;
    private final StructureAnalyzer structureAnalyzer;
    private final TypeAnalyzer typeAnalyzer;
    private final CodeGenerator codeGenerator;
    private final ConventionDetector conventionDetector;

    private Collaborators(Builder builder) {
        programGenerator = Objects.requireNonNull(builder.programGenerator, "programGenerator");
        functionsGenerator = Objects.requireNonNull(builder.functionsGenerator, "functionsGenerator");
        dataflowAnalyzer = builder.dataflowAnalyzer;
        signatureAnalyzer = builder.signatureAnalyzer;
        variableAnalyzer = builder.variableAnalyzer;
        structureAnalyzer = builder.structureAnalyzer;
        typeAnalyzer = builder.typeAnalyzer;
        codeGenerator = builder.codeGenerator;
        conventionDetector = builder.conventionDetector;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProgramGenerator getProgramGenerator() {
        return programGenerator;
    }

    public FunctionsGenerator getFunctionsGenerator() {
        return functionsGenerator;
    }

    public DataflowAnalyzer getDataflowAnalyzer() {
        return dataflowAnalyzer;
    }

    public SignatureAnalyzer getSignatureAnalyzer() {
        return signatureAnalyzer;
    }

    public VariableAnalyzer getVariableAnalyzer() {
        return variableAnalyzer;
    }

    public StructureAnalyzer getStructureAnalyzer() {
        return structureAnalyzer;
    }

    public TypeAnalyzer getTypeAnalyzer() {
        return typeAnalyzer;
    }

    public CodeGenerator getCodeGenerator() {
        return codeGenerator;
    }

    public ConventionDetector getConventionDetector() {
        return conventionDetector;
    }

    /**
     * A structure analyzer that recovers no structure, giving every block its own node.
     *
     * @return The analyzer.
     */
    public static StructureAnalyzer flatStructure() {
        return (function, dataflow) -> {
            List<Node> nodes = new ArrayList<>();
            for (BasicBlock block : function.blocks) {
                nodes.add(new BasicNode(block));
            }
            return new Graph(nodes, null);
        };
    }

    /**
     * A builder for {@link Collaborators}.
     */
    public static class Builder {
        private ProgramGenerator programGenerator;
        private FunctionsGenerator functionsGenerator;
        private DataflowAnalyzer dataflowAnalyzer = (dataflow, function, architecture, hooks, token) -> {
        };
        private SignatureAnalyzer signatureAnalyzer = stage -> new Signatures();
        private VariableAnalyzer variableAnalyzer = stage -> new Variables();
        private StructureAnalyzer structureAnalyzer = flatStructure();
        private TypeAnalyzer typeAnalyzer = stage -> new Types();
        private CodeGenerator codeGenerator = stage -> Tree.empty();
        private ConventionDetector conventionDetector = ConventionDetector.NONE;

        public Builder setProgramGenerator(@NotNull ProgramGenerator programGenerator) {
            this.programGenerator = programGenerator;
            return this;
        }

        public Builder setFunctionsGenerator(@NotNull FunctionsGenerator functionsGenerator) {
            this.functionsGenerator = functionsGenerator;
            return this;
        }

        public Builder setDataflowAnalyzer(@NotNull DataflowAnalyzer dataflowAnalyzer) {
            this.dataflowAnalyzer = dataflowAnalyzer;
            return this;
        }

        public Builder setSignatureAnalyzer(@NotNull SignatureAnalyzer signatureAnalyzer) {
            this.signatureAnalyzer = signatureAnalyzer;
            return this;
        }

        public Builder setVariableAnalyzer(@NotNull VariableAnalyzer variableAnalyzer) {
            this.variableAnalyzer = variableAnalyzer;
            return this;
        }

        public Builder setStructureAnalyzer(@NotNull StructureAnalyzer structureAnalyzer) {
            this.structureAnalyzer = structureAnalyzer;
            return this;
        }

        public Builder setTypeAnalyzer(@NotNull TypeAnalyzer typeAnalyzer) {
            this.typeAnalyzer = typeAnalyzer;
            return this;
        }

        public Builder setCodeGenerator(@NotNull CodeGenerator codeGenerator) {
            this.codeGenerator = codeGenerator;
            return this;
        }

        /**
         * Set the calling convention detector, replacing the default one, which detects nothing.
         *
         * @param conventionDetector The detector.
         * @return This builder.
         */
        public Builder setConventionDetector(@NotNull ConventionDetector conventionDetector) {
            this.conventionDetector = conventionDetector;
            return this;
        }

        /**
         * Build the collaborators.
         *
         * @return The collaborators.
         * @throws NullPointerException If the program or functions generator is missing.
         */
        public Collaborators build() {
            return new Collaborators(this);
        }
    }
}
