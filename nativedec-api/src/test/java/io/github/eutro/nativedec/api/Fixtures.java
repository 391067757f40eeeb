package io.github.eutro.nativedec.api;

import io.github.eutro.nativedec.api.analysis.FunctionsGenerator;
import io.github.eutro.nativedec.api.analysis.ProgramGenerator;
import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.arch.Demangler;
import io.github.eutro.nativedec.core.arch.Image;
import io.github.eutro.nativedec.core.arch.Instructions;
import io.github.eutro.nativedec.core.calling.CallHook;
import io.github.eutro.nativedec.core.calling.CalleeId;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.ReturnHook;
import io.github.eutro.nativedec.core.calling.Signature;
import io.github.eutro.nativedec.core.dflow.Dataflow;
import io.github.eutro.nativedec.core.dflow.ReachingDefinitions;
import io.github.eutro.nativedec.core.dflow.Value;
import io.github.eutro.nativedec.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A toy lifter, partitioner and dataflow analyzer to drive the pipeline with.
 */
final class Fixtures {
    static final int SIZE = 32;
    static final MemoryLocation R0 = new MemoryLocation(MemoryDomain.FIRST_REGISTER, 0, SIZE);
    static final MemoryLocation R1 = new MemoryLocation(MemoryDomain.FIRST_REGISTER + 1, 0, SIZE);

    private Fixtures() {
    }

    static MemoryLocation global(long address) {
        return new MemoryLocation(MemoryDomain.MEMORY, address * 8, SIZE);
    }

    static long entry(int index) {
        return 0x1000L * (index + 1);
    }

    static class TestImage implements Image {
        final Map<Long, String> names = new HashMap<>();
        Demangler demangler = Demangler.NONE;
        final Instructions instructions = new Instructions();

        @Override
        public Architecture getArchitecture() {
            return Architecture.GENERIC;
        }

        @Override
        public @Nullable String getName(long address) {
            return names.get(address);
        }

        @Override
        public Demangler getDemangler() {
            return demangler;
        }

        @Override
        public Instructions getInstructions() {
            return instructions;
        }
    }

    /**
     * Lift {@code count} single-block functions. Function {@code i} is at {@link #entry(int)},
     * and does {@code r0 = [0x100+i]; [0x200+i] = r0 + 1; r1 = r0;} then calls function
     * {@code i+1}, if there is one, and returns.
     *
     * @param count The number of functions.
     * @return The generator.
     */
    static ProgramGenerator chain(int count) {
        return (image, token) -> {
            Program program = new Program();
            for (int i = 0; i < count; i++) {
                BasicBlock block = program.addBasicBlock(new BasicBlock(entry(i)));
                block.addStatement(new Assignment(new MemoryLocationAccess(R0),
                        new MemoryLocationAccess(global(0x100 + i))));
                block.addStatement(new Assignment(new MemoryLocationAccess(global(0x200 + i)),
                        new BinaryOperator(BinaryOperator.Op.ADD,
                                new MemoryLocationAccess(R0),
                                new IntConst(1, SIZE),
                                SIZE)));
                block.addStatement(new Assignment(new MemoryLocationAccess(R1), new MemoryLocationAccess(R0)));
                if (i + 1 < count) {
                    block.addStatement(new Call(new IntConst(entry(i + 1), SIZE)));
                    program.addCalledAddress(entry(i + 1));
                }
                block.addStatement(new Return());
            }
            return program;
        };
    }

    /**
     * Makes a function of each block.
     */
    static final FunctionsGenerator ONE_PER_BLOCK = program -> {
        Functions functions = new Functions();
        for (BasicBlock block : program.getBasicBlocks()) {
            Function function = new Function();
            function.blocks.add(block);
            functions.add(function);
        }
        return functions;
    };

    /**
     * Computes reaching definitions of register and global accesses within each block,
     * and resolves calls to constant addresses.
     *
     * @param dataflow The dataflow to fill.
     * @param function The function.
     * @param hooks    The calling model.
     */
    static void blockLocalDataflow(Dataflow dataflow, Function function, Hooks hooks) {
        for (BasicBlock block : function.blocks) {
            Map<MemoryLocation, Term> lastWrites = new HashMap<>();
            for (Statement statement : block.getStatements()) {
                for (Term term : statement.getTerms()) {
                    visit(dataflow, term, lastWrites);
                }
                if (statement instanceof Call) {
                    Call call = (Call) statement;
                    if (call.getTarget() instanceof IntConst) {
                        hooks.setCalleeId(call, CalleeId.ofAddress(((IntConst) call.getTarget()).getValue()));
                    }
                    Signature signature = hooks.getSignatures().getSignature(hooks.getCalleeId(call));
                    CallHook callHook = hooks.getCallHook(call);
                    if (signature != null && callHook != null) {
                        for (MemoryLocation argument : signature.arguments()) {
                            visit(dataflow, callHook.getArgumentTerm(argument), lastWrites);
                        }
                    }
                } else if (statement instanceof Return) {
                    Signature signature = hooks.getSignatures().getSignature(hooks.getCalleeId(function));
                    ReturnHook returnHook = hooks.getReturnHook(function, (Return) statement);
                    if (signature != null && signature.returnValue() != null && returnHook != null) {
                        visit(dataflow, returnHook.getReturnValueTerm(signature.returnValue()), lastWrites);
                    }
                }
            }
        }
    }

    private static void visit(Dataflow dataflow, Term term, Map<MemoryLocation, Term> lastWrites) {
        for (Term child : term.getChildren()) {
            visit(dataflow, child, lastWrites);
        }
        if (term instanceof IntConst) {
            dataflow.setValue(term, Value.concrete(((IntConst) term).getValue()));
        } else if (term instanceof MemoryLocationAccess) {
            MemoryLocation location = ((MemoryLocationAccess) term).getMemoryLocation();
            dataflow.setMemoryLocation(term, location);
            if (term.isWrite()) {
                lastWrites.put(location, term);
            } else {
                Term definition = lastWrites.get(location);
                if (definition != null) {
                    dataflow.setDefinitions(term, ReachingDefinitions.builder()
                            .addDefinition(location, definition)
                            .build());
                }
            }
        }
    }
}
