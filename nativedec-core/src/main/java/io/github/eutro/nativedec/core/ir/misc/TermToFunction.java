package io.github.eutro.nativedec.core.ir.misc;

import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.calling.Signatures;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.Functions;
import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps every term of a program, hook terms included, to the function it belongs to.
 */
public final class TermToFunction {
    private final Map<Term, Function> functions = new IdentityHashMap<>();

    public TermToFunction(Functions functions, @Nullable Hooks hooks, @Nullable Signatures signatures) {
        for (Function function : functions.list()) {
            CensusVisitor census = new CensusVisitor(hooks, signatures);
            census.visit(function);
            for (Term term : census.terms()) {
                this.functions.put(term, function);
            }
        }
    }

    /**
     * Get the function a term belongs to.
     *
     * @param term The term.
     * @return The function, or null if the term is not part of any.
     */
    public @Nullable Function getFunction(Term term) {
        return functions.get(term);
    }

    public int size() {
        return functions.size();
    }
}
