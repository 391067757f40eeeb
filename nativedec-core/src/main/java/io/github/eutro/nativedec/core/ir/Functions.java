package io.github.eutro.nativedec.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The functions a {@link Program} was partitioned into.
 */
public final class Functions {
    private final List<Function> list = new ArrayList<>();

    public void add(Function function) {
        list.add(function);
    }

    /**
     * Get the functions, in the order the partitioner produced them.
     *
     * @return An unmodifiable view of the functions.
     */
    public List<Function> list() {
        return Collections.unmodifiableList(list);
    }

    public int size() {
        return list.size();
    }
}
