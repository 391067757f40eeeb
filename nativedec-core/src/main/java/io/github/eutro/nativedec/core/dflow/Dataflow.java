package io.github.eutro.nativedec.core.dflow;

import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The dataflow facts of one function, as computed by the dataflow analyzer.
 * <p>
 * Keyed by term identity. Filled by a single analyzer, read-only afterwards.
 */
public final class Dataflow {
    private final Map<Term, ReachingDefinitions> definitions = new HashMap<>();
    private final Map<Term, MemoryLocation> memoryLocations = new HashMap<>();
    private final Map<Term, Value> values = new HashMap<>();

    /**
     * Get the definitions reaching a read term.
     *
     * @param term The term.
     * @return The definitions, empty if none were recorded.
     */
    public ReachingDefinitions getDefinitions(Term term) {
        return definitions.getOrDefault(term, ReachingDefinitions.empty());
    }

    public void setDefinitions(Term term, ReachingDefinitions reachingDefinitions) {
        definitions.put(term, reachingDefinitions);
    }

    /**
     * Get the memory location a term accesses.
     *
     * @param term The term.
     * @return The location, or null if it could not be resolved.
     */
    public @Nullable MemoryLocation getMemoryLocation(Term term) {
        return memoryLocations.get(term);
    }

    public void setMemoryLocation(Term term, MemoryLocation memoryLocation) {
        memoryLocations.put(term, memoryLocation);
    }

    /**
     * Get what is known about the value of a term.
     *
     * @param term The term.
     * @return The value, {@link Value#unknown()} if nothing was recorded.
     */
    public Value getValue(Term term) {
        return values.getOrDefault(term, Value.unknown());
    }

    public void setValue(Term term, Value value) {
        values.put(term, value);
    }
}
