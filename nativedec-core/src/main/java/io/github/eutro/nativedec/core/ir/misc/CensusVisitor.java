package io.github.eutro.nativedec.core.ir.misc;

import io.github.eutro.nativedec.core.calling.CallHook;
import io.github.eutro.nativedec.core.calling.CalleeId;
import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.ReturnHook;
import io.github.eutro.nativedec.core.calling.Signature;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.ir.BasicBlock;
import io.github.eutro.nativedec.core.ir.Call;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.Return;
import io.github.eutro.nativedec.core.ir.Statement;
import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Enumerates every statement and term of the functions it visits.
 * <p>
 * Given the calling model, this includes the terms materialized by the hooks
 * of calls and returns whose signature is known.
 */
public final class CensusVisitor {
    @Nullable
    private final Hooks hooks;
    @Nullable
    private final Signatures signatures;

    private final List<Statement> statements = new ArrayList<>();
    private final List<Term> terms = new ArrayList<>();
    private final Set<Statement> seenStatements = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Term> seenTerms = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Construct a census visitor that sees only the terms the statements own.
     */
    public CensusVisitor() {
        this(null, null);
    }

    /**
     * Construct a census visitor that also sees the terms of call and return hooks.
     *
     * @param hooks      The calling model.
     * @param signatures The known signatures.
     */
    public CensusVisitor(@Nullable Hooks hooks, @Nullable Signatures signatures) {
        this.hooks = hooks;
        this.signatures = signatures;
    }

    /**
     * Visit every statement and term of a function.
     *
     * @param function The function.
     */
    public void visit(Function function) {
        for (BasicBlock block : function.blocks) {
            for (Statement statement : block.getStatements()) {
                visit(function, statement);
            }
        }
    }

    private void visit(Function function, Statement statement) {
        if (!seenStatements.add(statement)) return;
        statements.add(statement);
        for (Term term : statement.getTerms()) {
            visit(term);
        }
        if (hooks == null || signatures == null) return;

        if (statement instanceof Call) {
            Call call = (Call) statement;
            Signature signature = signatures.getSignature(hooks.getCalleeId(call));
            if (signature == null) return;
            CallHook callHook = hooks.getCallHook(call);
            if (callHook == null) return;
            for (MemoryLocation argument : signature.arguments()) {
                visit(callHook.getArgumentTerm(argument));
            }
        } else if (statement instanceof Return) {
            CalleeId calleeId = hooks.getCalleeId(function);
            Signature signature = signatures.getSignature(calleeId);
            if (signature == null || signature.returnValue() == null) return;
            ReturnHook returnHook = hooks.getReturnHook(function, (Return) statement);
            if (returnHook == null) return;
            visit(returnHook.getReturnValueTerm(signature.returnValue()));
        }
    }

    private void visit(Term root) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term term = stack.pop();
            if (!seenTerms.add(term)) continue;
            terms.add(term);
            List<Term> children = term.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Get the statements visited, in visiting order.
     *
     * @return The statements.
     */
    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Get the terms visited, each before its subterms.
     *
     * @return The terms.
     */
    public List<Term> terms() {
        return Collections.unmodifiableList(terms);
    }

    public boolean contains(Statement statement) {
        return seenStatements.contains(statement);
    }

    public boolean contains(Term term) {
        return seenTerms.contains(term);
    }
}
