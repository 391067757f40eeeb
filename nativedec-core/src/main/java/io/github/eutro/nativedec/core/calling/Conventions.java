package io.github.eutro.nativedec.core.calling;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The calling conventions of callees, as far as they are known.
 */
public final class Conventions {
    private final Map<CalleeId, Convention> conventions = new ConcurrentHashMap<>();

    public void setConvention(CalleeId calleeId, Convention convention) {
        conventions.put(calleeId, convention);
    }

    public @Nullable Convention getConvention(CalleeId calleeId) {
        return conventions.get(calleeId);
    }

    public int size() {
        return conventions.size();
    }
}
