package io.github.eutro.nativedec.core.util;

import io.github.eutro.nativedec.core.ir.Function;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An insert-only map holding one artifact per function.
 * <p>
 * Workers analysing different functions may insert concurrently.
 * Inserting twice for the same function is an error.
 *
 * @param <V> The type of the artifact.
 */
public abstract class FunctionMap<V> {
    private final Map<Function, V> map = new ConcurrentHashMap<>();

    /**
     * Record the artifact of a function.
     *
     * @param function The function.
     * @param value    The artifact.
     */
    public void emplace(Function function, V value) {
        if (map.putIfAbsent(function, value) != null) {
            throw new IllegalStateException(getClass().getSimpleName()
                    + " already has an entry for " + function.getName());
        }
    }

    /**
     * Get the artifact of a function, if one was recorded.
     *
     * @param function The function.
     * @return The artifact, or null.
     */
    public @Nullable V get(Function function) {
        return map.get(function);
    }

    /**
     * Get the artifact of a function, which must have been recorded.
     *
     * @param function The function.
     * @return The artifact.
     */
    public V at(Function function) {
        V value = map.get(function);
        if (value == null) {
            throw new IllegalStateException(getClass().getSimpleName()
                    + " has no entry for " + function.getName());
        }
        return value;
    }

    public boolean contains(Function function) {
        return map.containsKey(function);
    }

    public int size() {
        return map.size();
    }
}
