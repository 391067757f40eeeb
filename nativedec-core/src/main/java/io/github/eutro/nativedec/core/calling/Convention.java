package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.MemoryLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A calling convention: the locations arguments may be passed in, in order of preference.
 */
public final class Convention {
    private final String name;
    private final List<MemoryLocation> argumentLocations;

    public Convention(String name, List<MemoryLocation> argumentLocations) {
        this.name = name;
        this.argumentLocations = Collections.unmodifiableList(new ArrayList<>(argumentLocations));
    }

    public String getName() {
        return name;
    }

    public List<MemoryLocation> getArgumentLocations() {
        return argumentLocations;
    }

    @Override
    public String toString() {
        return name;
    }
}
