package io.github.eutro.nativedec.api;

import io.github.eutro.nativedec.api.analysis.Collaborators;
import io.github.eutro.nativedec.api.events.PassEvent;
import io.github.eutro.nativedec.api.events.StageEvent;
import io.github.eutro.nativedec.api.stage.*;
import io.github.eutro.nativedec.core.calling.CallHook;
import io.github.eutro.nativedec.core.calling.CalleeId;
import io.github.eutro.nativedec.core.calling.Convention;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.Signature;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.ir.Call;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.IntConst;
import io.github.eutro.nativedec.core.ir.Statement;
import io.github.eutro.nativedec.core.ir.Term;
import io.github.eutro.nativedec.core.likec.Tree;
import io.github.eutro.nativedec.core.likec.TreeNode;
import io.github.eutro.nativedec.core.liveness.Liveness;
import io.github.eutro.nativedec.core.vars.Variables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.eutro.nativedec.api.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DecompilerTest {
    private final Fixtures.TestImage image = new Fixtures.TestImage();
    private final CancellationToken token = new CancellationToken();
    private final List<String> messages = Collections.synchronizedList(new ArrayList<>());
    private final AnalysisContext context = new AnalysisContext(image, token, messages::add);
    private final AtomicInteger dataflowRuns = new AtomicInteger();

    private Collaborators.Builder collaborators(int count) {
        return Collaborators.builder()
                .setProgramGenerator(chain(count))
                .setFunctionsGenerator(ONE_PER_BLOCK)
                .setDataflowAnalyzer((dataflow, function, architecture, hooks, token) -> {
                    dataflowRuns.incrementAndGet();
                    blockLocalDataflow(dataflow, function, hooks);
                });
    }

    private static DecompilerOptions.Builder options() {
        return DecompilerOptions.builder()
                .setPreferConstants(false)
                .setCheckTree(false);
    }

    private static Call findCall(Function function) {
        for (Statement statement : function.getEntry().getStatements()) {
            if (statement instanceof Call) return (Call) statement;
        }
        throw new AssertionError("no call in " + function);
    }

    @Test
    void passOrder() {
        Decompiler decompiler = new Decompiler(collaborators(3).build(), options().build());
        List<String> passes = new ArrayList<>();
        List<String> stages = new ArrayList<>();
        decompiler.listen(PassEvent.class, e -> passes.add(e.passName));
        decompiler.listen(StageEvent.class, e -> {
            assertSame(e.stage, e.context.getStage());
            stages.add(e.passName);
        });

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        List<String> expected = Arrays.asList(
                "createProgram",
                "createFunctions",
                "dataflowAnalysis",
                "reconstructSignatures",
                "dataflowAnalysis",
                "reconstructVariables",
                "structuralAnalysis",
                "livenessAnalysis",
                "reconstructTypes",
                "generateTree",
                "computeTermToFunctionMapping"
        );
        assertEquals(expected, passes);
        assertEquals(expected, stages);
        assertInstanceOf(CompletedStage.class, context.getStage());
    }

    @Test
    void treeCheckRunsWhenEnabled() {
        Decompiler decompiler = new Decompiler(collaborators(1).build(), options().setCheckTree(true).build());
        List<String> passes = new ArrayList<>();
        decompiler.listen(PassEvent.class, e -> passes.add(e.passName));

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        assertEquals(Arrays.asList("generateTree", "checkTree", "computeTermToFunctionMapping"),
                passes.subList(passes.size() - 3, passes.size()));
    }

    @Test
    void progressMessages() {
        new Decompiler(collaborators(2).build(), options().build()).decompile(context);

        assertEquals("Decompiling.", messages.get(0));
        assertEquals("Creating intermediate representation of the program.", messages.get(1));
        assertEquals("Decompilation completed.", messages.get(messages.size() - 1));
        assertTrue(messages.contains("Dataflow analysis of func_1000."));
        assertTrue(messages.contains("Liveness analysis of func_2000."));
        assertEquals(2, Collections.frequency(messages, "Dataflow analysis."));
        assertEquals(1, Collections.frequency(messages, "Reconstructing function signatures."));
        assertFalse(messages.contains("Checking AST."));
    }

    @Test
    void signaturesSeeDataflowOfEveryFunction() {
        AtomicReference<Hooks> firstHooks = new AtomicReference<>();
        AtomicInteger runsBeforeVariables = new AtomicInteger();
        Decompiler decompiler = new Decompiler(collaborators(4)
                .setSignatureAnalyzer(stage -> {
                    for (Function function : stage.getFunctions().list()) {
                        assertTrue(stage.getDataflows().contains(function), function::toString);
                    }
                    assertEquals(4, dataflowRuns.get());
                    firstHooks.set(stage.getHooks());
                    return new Signatures();
                })
                .setVariableAnalyzer(stage -> {
                    assertNotSame(firstHooks.get(), stage.getHooks());
                    assertEquals(4, stage.getDataflows().size());
                    runsBeforeVariables.set(dataflowRuns.get());
                    return new Variables();
                })
                .build(), options().build());

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        assertEquals(8, runsBeforeVariables.get());
        assertEquals(8, dataflowRuns.get());
    }

    @Test
    void rerunUsesReconstructedSignatures() {
        Signature signature = new Signature("callee", Collections.singletonList(R0), null);
        Decompiler decompiler = new Decompiler(collaborators(2)
                .setSignatureAnalyzer(stage -> {
                    Signatures signatures = new Signatures();
                    signatures.setSignature(CalleeId.ofAddress(entry(1)), signature);
                    return signatures;
                })
                .setVariableAnalyzer(stage -> {
                    assertSame(signature, stage.getSignatures().getSignature(CalleeId.ofAddress(entry(1))));
                    return new Variables();
                })
                .build(), options().build());

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);
        assertSame(signature, completed.getSignatures().getSignature(CalleeId.ofAddress(entry(1))));
    }

    @ParameterizedTest
    @CsvSource({
            "createProgram, ProgramStage",
            "createFunctions, FunctionsStage",
            "dataflowAnalysis, DataflowStage",
            "reconstructSignatures, CallingStage",
            "reconstructVariables, VariablesStage",
            "structuralAnalysis, StructureStage",
            "livenessAnalysis, LivenessStage",
            "reconstructTypes, TypesStage",
            "generateTree, TreeStage",
            "checkTree, TreeStage",
    })
    void cancellationAfterPass(String pass, String stageName) {
        Decompiler decompiler = new Decompiler(collaborators(2).build(), options().setCheckTree(true).build());
        List<String> passes = new ArrayList<>();
        decompiler.listen(PassEvent.class, e -> passes.add(e.passName));
        decompiler.listen(StageEvent.class, e -> {
            if (e.passName.equals(pass)) token.cancel();
        });

        assertEquals(Outcome.CANCELLED, decompiler.decompile(context));
        assertEquals(pass, passes.get(passes.size() - 1));
        Stage stage = context.getStage();
        assertNotNull(stage);
        assertEquals(stageName, stage.getClass().getSimpleName());
        assertFalse(messages.contains("Decompilation completed."));
    }

    @Test
    void cancellationBeforeFirstPass() {
        token.cancel();
        Decompiler decompiler = new Decompiler(collaborators(1).build(), options().build());
        List<String> passes = new ArrayList<>();
        decompiler.listen(PassEvent.class, e -> passes.add(e.passName));

        assertEquals(Outcome.CANCELLED, decompiler.decompile(context));
        assertTrue(passes.isEmpty());
        assertNull(context.getStage());
    }

    @Test
    void cancellationBetweenFunctions() {
        Decompiler decompiler = new Decompiler(collaborators(3)
                .setDataflowAnalyzer((dataflow, function, architecture, hooks, token) -> {
                    if (dataflowRuns.incrementAndGet() == 2) token.cancel();
                })
                .build(), options().build());

        assertEquals(Outcome.CANCELLED, decompiler.decompile(context));
        assertEquals(2, dataflowRuns.get());
        Stage stage = context.getStage();
        assertNotNull(stage);
        assertEquals(FunctionsStage.class, stage.getClass());
        assertFalse(messages.contains("Dataflow analysis of func_3000."));
    }

    @Test
    void failureNamesPassAndFunction() {
        Decompiler decompiler = new Decompiler(collaborators(3)
                .setStructureAnalyzer((function, dataflow) -> {
                    if ("func_2000".equals(function.getName())) {
                        throw new IllegalStateException("irreducible");
                    }
                    return Collaborators.flatStructure().analyze(function, dataflow);
                })
                .build(), options().build());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> decompiler.decompile(context));
        assertEquals("irreducible", e.getMessage());
        List<String> notes = new ArrayList<>();
        for (Throwable suppressed : e.getSuppressed()) {
            notes.add(suppressed.getMessage());
        }
        assertEquals(Arrays.asList("in function func_2000", "running pass structuralAnalysis"), notes);
        assertEquals(VariablesStage.class, context.getStage().getClass());
    }

    @Test
    void failureOnWorkerThread() {
        Decompiler decompiler = new Decompiler(collaborators(6)
                .setStructureAnalyzer((function, dataflow) -> {
                    if ("func_4000".equals(function.getName())) {
                        throw new IllegalStateException("irreducible");
                    }
                    return Collaborators.flatStructure().analyze(function, dataflow);
                })
                .build(), options().setParallelism(3).build());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> decompiler.decompile(context));
        assertEquals(2, e.getSuppressed().length);
        assertEquals("in function func_4000", e.getSuppressed()[0].getMessage());
    }

    @Test
    void conventionDetectorIsConsulted() {
        List<CalleeId> detected = Collections.synchronizedList(new ArrayList<>());
        Decompiler decompiler = new Decompiler(collaborators(2)
                .setSignatureAnalyzer(stage -> {
                    Signatures signatures = new Signatures();
                    signatures.setSignature(CalleeId.ofAddress(entry(1)),
                            new Signature("callee", Collections.singletonList(R0), null));
                    return signatures;
                })
                .setConventionDetector((calleeId, conventions) -> {
                    detected.add(calleeId);
                    conventions.setConvention(calleeId, new Convention("test", Collections.singletonList(R0)));
                })
                .build(), options().build());

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        assertTrue(detected.contains(CalleeId.ofAddress(entry(1))));

        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);
        Function caller = completed.getFunctions().list().get(0);
        CallHook hook = completed.getHooks().getCallHook(findCall(caller));
        assertNotNull(hook);
        Term argument = hook.getArgumentTerm(R0);
        assertTrue(completed.getLivenesses().at(caller).isLive(argument));
        assertSame(caller, completed.getTermToFunction().getFunction(argument));
    }

    @Test
    void withoutConventionArgumentsAreNotHooked() {
        Decompiler decompiler = new Decompiler(collaborators(2)
                .setSignatureAnalyzer(stage -> {
                    Signatures signatures = new Signatures();
                    signatures.setSignature(CalleeId.ofAddress(entry(1)),
                            new Signature("callee", Collections.singletonList(R0), null));
                    return signatures;
                })
                .build(), options().build());

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);
        Function caller = completed.getFunctions().list().get(0);
        assertNull(completed.getHooks().getCallHook(findCall(caller)));
    }

    @Test
    void livenessOfChain() {
        assertEquals(Outcome.COMPLETED, new Decompiler(collaborators(2).build(), options().build()).decompile(context));
        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);

        for (Function function : completed.getFunctions().list()) {
            Liveness liveness = completed.getLivenesses().at(function);
            assertTrue(liveness.isFrozen());
            List<Statement> statements = function.getEntry().getStatements();
            // [0x200+i] = r0 + 1 keeps r0 = [0x100+i] alive, r1 = r0 is dead
            for (Term term : statements.get(0).getTerms()) assertTrue(liveness.isLive(term), term::toString);
            for (Term term : statements.get(1).getTerms()) assertTrue(liveness.isLive(term), term::toString);
            for (Term term : statements.get(2).getTerms()) assertFalse(liveness.isLive(term), term::toString);
        }
        Call call = findCall(completed.getFunctions().list().get(0));
        assertTrue(completed.getLivenesses().at(completed.getFunctions().list().get(0)).isLive(call.getTarget()));
    }

    private List<List<String>> liveTermsByFunction(DecompilerOptions options) {
        AnalysisContext context = new AnalysisContext(image, new CancellationToken(), message -> {
        });
        assertEquals(Outcome.COMPLETED, new Decompiler(collaborators(8).build(), options).decompile(context));
        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);
        List<List<String>> result = new ArrayList<>();
        for (Function function : completed.getFunctions().list()) {
            List<String> live = new ArrayList<>();
            for (Term term : completed.getLivenesses().at(function).getLiveTerms()) {
                live.add(term.toString());
            }
            Collections.sort(live);
            result.add(live);
        }
        return result;
    }

    @Test
    void parallelMatchesSequential() {
        List<List<String>> sequential = liveTermsByFunction(options().build());
        List<List<String>> parallel = liveTermsByFunction(options().setParallelism(4).build());
        assertEquals(8, sequential.size());
        assertEquals(sequential, parallel);
    }

    @Test
    void treeCheckAcceptsProgramNodes() {
        Decompiler decompiler = new Decompiler(collaborators(2)
                .setCodeGenerator(stage -> {
                    Function function = stage.getFunctions().list().get(0);
                    Statement statement = function.getEntry().getStatements().get(0);
                    TreeNode root = TreeNode.of("unit");
                    root.addChild(TreeNode.of(statement).addChild(TreeNode.of(statement.getTerms().get(0))));
                    return new Tree(root);
                })
                .build(), options().setCheckTree(true).build());

        assertEquals(Outcome.COMPLETED, decompiler.decompile(context));
    }

    @Test
    void treeCheckRejectsForeignTerms() {
        Collaborators collaborators = collaborators(2)
                .setCodeGenerator(stage -> {
                    TreeNode root = TreeNode.of("unit");
                    root.addChild(TreeNode.of(new IntConst(7, SIZE)));
                    return new Tree(root);
                })
                .build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new Decompiler(collaborators, options().setCheckTree(true).build()).decompile(context));
        assertEquals("running pass checkTree", e.getSuppressed()[0].getMessage());
        assertEquals(TreeStage.class, context.getStage().getClass());

        AnalysisContext unchecked = new AnalysisContext(image);
        assertEquals(Outcome.COMPLETED, new Decompiler(collaborators, options().build()).decompile(unchecked));
    }

    @Test
    void termToFunction() {
        assertEquals(Outcome.COMPLETED, new Decompiler(collaborators(3).build(), options().build()).decompile(context));
        CompletedStage completed = context.getStage(CompletedStage.class);
        assertNotNull(completed);
        for (Function function : completed.getFunctions().list()) {
            for (Statement statement : function.getEntry().getStatements()) {
                for (Term term : statement.getTerms()) {
                    assertSame(function, completed.getTermToFunction().getFunction(term));
                }
            }
        }
        assertNull(completed.getTermToFunction().getFunction(new IntConst(0, SIZE)));
    }
}
