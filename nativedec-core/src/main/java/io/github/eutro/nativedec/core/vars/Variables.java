package io.github.eutro.nativedec.core.vars;

import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the terms of the program to the variables they access.
 */
public final class Variables {
    private final Map<Term, Variable> variables = new ConcurrentHashMap<>();

    public void setVariable(Term term, Variable variable) {
        variables.put(term, variable);
    }

    public @Nullable Variable getVariable(Term term) {
        return variables.get(term);
    }

    public Map<Term, Variable> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    public int size() {
        return variables.size();
    }
}
