package io.github.eutro.nativedec.core.liveness;

import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.calling.CallHook;
import io.github.eutro.nativedec.core.calling.CalleeId;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.ReturnHook;
import io.github.eutro.nativedec.core.calling.Signature;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.cflow.BasicNode;
import io.github.eutro.nativedec.core.cflow.Graph;
import io.github.eutro.nativedec.core.cflow.Node;
import io.github.eutro.nativedec.core.cflow.Switch;
import io.github.eutro.nativedec.core.dflow.Dataflow;
import io.github.eutro.nativedec.core.dflow.ReachingDefinitions;
import io.github.eutro.nativedec.core.ir.*;
import io.github.eutro.nativedec.core.ir.misc.CensusVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Computes the {@link Liveness} of a function.
 * <p>
 * A term is live if it is a root, or if a live term depends on it. Roots are
 * the conditions and address targets of jumps that are not structurally dead,
 * call targets, the arguments of calls with a known signature, writes to global
 * memory, writes through unresolved or global pointers, and the values
 * returned by functions with a known signature. From the roots, liveness
 * propagates backwards: a live read makes its reaching definitions live,
 * a live write makes its source live, operators make their operands live, and
 * a choice makes live whichever alternative it picks.
 * <p>
 * An analyzer is good for one run.
 */
public class LivenessAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessAnalyzer.class);

    private final Liveness liveness;
    private final Function function;
    private final Dataflow dataflow;
    private final Architecture architecture;
    private final Graph regionGraph;
    private final Hooks hooks;
    private final Signatures signatures;
    private final boolean preferConstants;

    private int[] deadJumps = new int[0];
    private final Deque<Term> pending = new ArrayDeque<>();
    private boolean propagating;

    /**
     * Construct a liveness analyzer.
     *
     * @param liveness        The liveness to fill.
     * @param function        The function to analyse.
     * @param dataflow        The dataflow facts of the function.
     * @param architecture    The architecture, deciding what memory is global.
     * @param regionGraph     The structured control-flow graph of the function.
     * @param hooks           The calling model.
     * @param signatures      The known signatures.
     * @param preferConstants Whether reads with a concrete value should not make their definitions live.
     */
    public LivenessAnalyzer(
            Liveness liveness,
            Function function,
            Dataflow dataflow,
            Architecture architecture,
            Graph regionGraph,
            Hooks hooks,
            Signatures signatures,
            boolean preferConstants
    ) {
        this.liveness = liveness;
        this.function = function;
        this.dataflow = dataflow;
        this.architecture = architecture;
        this.regionGraph = regionGraph;
        this.hooks = hooks;
        this.signatures = signatures;
        this.preferConstants = preferConstants;
    }

    /**
     * Run the analysis, marking live terms in the liveness.
     */
    public void analyze() {
        deadJumps = findDeadJumps();

        CensusVisitor census = new CensusVisitor(hooks, signatures);
        census.visit(function);

        for (Statement statement : census.statements()) {
            computeLiveness(statement);
        }
        for (Term term : census.terms()) {
            computeLiveness(term);
        }

        CalleeId calleeId = hooks.getCalleeId(function);
        Signature signature = signatures.getSignature(calleeId);
        if (signature != null && signature.returnValue() != null) {
            for (Return ret : function.getReturns()) {
                ReturnHook returnHook = hooks.getReturnHook(function, ret);
                if (returnHook != null) {
                    makeLive(returnHook.getReturnValueTerm(signature.returnValue()));
                }
            }
        }
    }

    private int[] findDeadJumps() {
        int[] jumps = new int[regionGraph.getNodes().size()];
        int count = 0;
        for (Node node : regionGraph.getNodes()) {
            if (!(node instanceof Switch)) continue;
            BasicNode boundsCheckNode = ((Switch) node).boundsCheckNode();
            if (boundsCheckNode == null) continue;
            Jump jump = boundsCheckNode.basicBlock().getJump();
            if (jump != null) {
                jumps[count++] = jump.getId();
            }
        }
        jumps = Arrays.copyOf(jumps, count);
        Arrays.sort(jumps);
        return jumps;
    }

    private boolean isDead(Jump jump) {
        return Arrays.binarySearch(deadJumps, jump.getId()) >= 0;
    }

    private void computeLiveness(Statement statement) {
        switch (statement.getKind()) {
            case COMMENT:
            case INLINE_ASSEMBLY:
            case ASSIGNMENT:
            case KILL:
            case RETURN:
                break;
            case JUMP: {
                Jump jump = (Jump) statement;
                if (!isDead(jump)) {
                    if (jump.getCondition() != null) {
                        makeLive(jump.getCondition());
                    }
                    if (jump.getThenTarget().getAddress() != null) {
                        makeLive(jump.getThenTarget().getAddress());
                    }
                    JumpTarget elseTarget = jump.getElseTarget();
                    if (elseTarget != null && elseTarget.getAddress() != null) {
                        makeLive(elseTarget.getAddress());
                    }
                }
                break;
            }
            case CALL: {
                Call call = (Call) statement;
                makeLive(call.getTarget());

                Signature signature = signatures.getSignature(hooks.getCalleeId(call));
                if (signature != null) {
                    CallHook callHook = hooks.getCallHook(call);
                    if (callHook != null) {
                        for (MemoryLocation memoryLocation : signature.arguments()) {
                            makeLive(callHook.getArgumentTerm(memoryLocation));
                        }
                    }
                }
                break;
            }
            default:
                LOGGER.warn("unsupported kind of statement: {}", statement.getKind());
                break;
        }
    }

    private void computeLiveness(Term term) {
        switch (term.getKind()) {
            case INT_CONST:
            case INTRINSIC:
            case UNDEFINED:
            case UNARY_OPERATOR:
            case BINARY_OPERATOR:
            case CHOICE:
                break;
            case MEMORY_LOCATION_ACCESS:
                if (term.isWrite()
                        && architecture.isGlobalMemory(((MemoryLocationAccess) term).getMemoryLocation())) {
                    makeLive(term);
                }
                break;
            case DEREFERENCE:
                if (term.isWrite()) {
                    MemoryLocation memoryLocation = dataflow.getMemoryLocation(term);
                    if (memoryLocation == null || architecture.isGlobalMemory(memoryLocation)) {
                        makeLive(term);
                    }
                }
                break;
            default:
                LOGGER.warn("unsupported kind of term: {}", term.getKind());
                break;
        }
    }

    private void propagateLiveness(Term term) {
        if (preferConstants && term.isRead() && dataflow.getValue(term).isConcrete()) {
            return;
        }

        switch (term.getKind()) {
            case INT_CONST:
            case INTRINSIC:
            case UNDEFINED:
                break;
            case MEMORY_LOCATION_ACCESS:
                propagateAccess(term);
                break;
            case DEREFERENCE:
                propagateAccess(term);
                if (dataflow.getMemoryLocation(term) == null) {
                    makeLive(((Dereference) term).getAddress());
                }
                break;
            case UNARY_OPERATOR:
                makeLive(((UnaryOperator) term).getOperand());
                break;
            case BINARY_OPERATOR: {
                BinaryOperator binary = (BinaryOperator) term;
                makeLive(binary.getLeft());
                makeLive(binary.getRight());
                break;
            }
            case CHOICE: {
                Choice choice = (Choice) term;
                if (!dataflow.getDefinitions(choice.getPreferredTerm()).isEmpty()) {
                    makeLive(choice.getPreferredTerm());
                } else {
                    makeLive(choice.getDefaultTerm());
                }
                break;
            }
            default:
                LOGGER.warn("unsupported kind of term: {}", term.getKind());
                break;
        }
    }

    private void propagateAccess(Term term) {
        if (term.isRead()) {
            for (ReachingDefinitions.Chunk chunk : dataflow.getDefinitions(term).chunks()) {
                for (Term definition : chunk.definitions()) {
                    makeLive(definition);
                }
            }
        } else if (term.getSource() != null) {
            makeLive(term.getSource());
        }
    }

    private void makeLive(Term term) {
        if (!liveness.makeLive(term)) return;
        pending.push(term);
        if (propagating) return;
        propagating = true;
        try {
            while (!pending.isEmpty()) {
                propagateLiveness(pending.pop());
            }
        } finally {
            propagating = false;
        }
    }
}
