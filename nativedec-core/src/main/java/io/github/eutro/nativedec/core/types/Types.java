package io.github.eutro.nativedec.core.types;

import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the terms of the program to their reconstructed types.
 */
public final class Types {
    private final Map<Term, Type> types = new ConcurrentHashMap<>();

    public void setType(Term term, Type type) {
        types.put(term, type);
    }

    public @Nullable Type getType(Term term) {
        return types.get(term);
    }

    public int size() {
        return types.size();
    }
}
