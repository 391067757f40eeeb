package io.github.eutro.nativedec.api;

import io.github.eutro.nativedec.api.analysis.Collaborators;
import io.github.eutro.nativedec.api.events.DecompileEvent;
import io.github.eutro.nativedec.api.events.EventSupplier;
import io.github.eutro.nativedec.api.events.PassEvent;
import io.github.eutro.nativedec.api.events.StageEvent;
import io.github.eutro.nativedec.api.passes.*;
import io.github.eutro.nativedec.api.stage.*;
import io.github.eutro.nativedec.core.passes.IRPass;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the decompiler pipeline over an {@link AnalysisContext}.
 * <p>
 * Decompilation, performed when {@link #decompile(AnalysisContext)} is called, takes place as follows:
 * <ol>
 *     <li>The image is {@link CreateProgram lifted} into a program.</li>
 *     <li>The program is {@link CreateFunctions partitioned} into functions, which are named.</li>
 *     <li>{@link DataflowAnalysis Dataflow analysis} is run on every function.</li>
 *     <li>Function {@link ReconstructSignatures signatures are reconstructed}.</li>
 *     <li>Dataflow analysis is run again, under the new signatures.</li>
 *     <li>{@link ReconstructVariables Variables are reconstructed}.</li>
 *     <li>{@link StructuralAnalysis Structural analysis} is run on every function.</li>
 *     <li>{@link LivenessAnalysis Liveness analysis} is run on every function.</li>
 *     <li>{@link ReconstructTypes Types are reconstructed}.</li>
 *     <li>The output {@link GenerateTree tree is generated}.</li>
 *     <li>If {@link DecompilerOptions#isCheckTree() enabled}, the {@link CheckTree tree is checked}.</li>
 *     <li>Terms are {@link ComputeTermToFunction mapped} to their functions.</li>
 * </ol>
 * A {@link PassEvent} is fired before each pass, and a {@link StageEvent} after it,
 * once its stage is recorded in the context. Cancellation is polled before each pass.
 * <p>
 * A pass that fails aborts the decompilation, its exception propagating with a
 * suppressed exception naming the pass.
 */
public class Decompiler extends EventSupplier<DecompileEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Decompiler.class);

    private final Collaborators collaborators;
    private final DecompilerOptions options;

    public Decompiler(@NotNull Collaborators collaborators) {
        this(collaborators, DecompilerOptions.defaults());
    }

    public Decompiler(@NotNull Collaborators collaborators, @NotNull DecompilerOptions options) {
        this.collaborators = collaborators;
        this.options = options;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public DecompilerOptions getOptions() {
        return options;
    }

    /**
     * Decompile a context.
     * <p>
     * See the documentation of this class for details.
     *
     * @param context The context.
     * @return Whether decompilation completed or was cancelled.
     */
    public Outcome decompile(@NotNull AnalysisContext context) {
        context.getLogToken().log("Decompiling.");
        ExecutorService executor = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism())
                : null;
        try {
            ForFunctions forFunctions = new ForFunctions(executor);

            ProgramStage program = runPass(context, "createProgram",
                    new CreateProgram(collaborators.getProgramGenerator()), context);
            if (program == null) return cancelled(context);

            FunctionsStage functions = runPass(context, "createFunctions",
                    new CreateFunctions(collaborators.getFunctionsGenerator()), program);
            if (functions == null) return cancelled(context);

            DataflowAnalysis dataflowAnalysis = new DataflowAnalysis(
                    collaborators.getDataflowAnalyzer(),
                    collaborators.getConventionDetector(),
                    forFunctions
            );
            DataflowStage dataflow = runPass(context, "dataflowAnalysis", dataflowAnalysis, functions);
            if (dataflow == null) return cancelled(context);

            CallingStage calling = runPass(context, "reconstructSignatures",
                    new ReconstructSignatures(collaborators.getSignatureAnalyzer()), dataflow);
            if (calling == null) return cancelled(context);

            dataflow = runPass(context, "dataflowAnalysis", dataflowAnalysis, calling);
            if (dataflow == null) return cancelled(context);

            VariablesStage variables = runPass(context, "reconstructVariables",
                    new ReconstructVariables(collaborators.getVariableAnalyzer()), dataflow);
            if (variables == null) return cancelled(context);

            StructureStage structure = runPass(context, "structuralAnalysis",
                    new StructuralAnalysis(collaborators.getStructureAnalyzer(), forFunctions), variables);
            if (structure == null) return cancelled(context);

            LivenessStage liveness = runPass(context, "livenessAnalysis",
                    new LivenessAnalysis(options.isPreferConstants(), forFunctions), structure);
            if (liveness == null) return cancelled(context);

            TypesStage types = runPass(context, "reconstructTypes",
                    new ReconstructTypes(collaborators.getTypeAnalyzer()), liveness);
            if (types == null) return cancelled(context);

            TreeStage tree = runPass(context, "generateTree",
                    new GenerateTree(collaborators.getCodeGenerator()), types);
            if (tree == null) return cancelled(context);

            if (options.isCheckTree()) {
                tree = runPass(context, "checkTree", CheckTree.INSTANCE, tree);
                if (tree == null) return cancelled(context);
            }

            CompletedStage completed = runPass(context, "computeTermToFunctionMapping",
                    ComputeTermToFunction.INSTANCE, tree);
            if (completed == null) return cancelled(context);
        } finally {
            if (executor != null) executor.shutdownNow();
        }

        context.getLogToken().log("Decompilation completed.");
        return Outcome.COMPLETED;
    }

    private Outcome cancelled(AnalysisContext context) {
        Stage stage = context.getStage();
        LOGGER.info("decompilation cancelled after {}", stage == null ? "no pass" : stage.getClass().getSimpleName());
        return Outcome.CANCELLED;
    }

    private <A, B extends Stage> @Nullable B runPass(AnalysisContext context, String name, IRPass<A, B> pass, A input) {
        if (context.getCancellationToken().isCancelled()) return null;
        dispatch(PassEvent.class, new PassEvent(context, name));
        LOGGER.debug("running pass {}", name);

        B output;
        try {
            output = pass.run(input);
        } catch (Throwable t) {
            t.addSuppressed(new RuntimeException("running pass " + name));
            throw t;
        }
        if (output == null) return null;

        context.advance(output);
        dispatch(StageEvent.class, new StageEvent(context, name, output));
        return output;
    }
}
