package io.github.eutro.nativedec.core.dflow;

import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The definitions reaching a read, split into chunks of the read's memory location.
 * <p>
 * Each chunk is a sub-location together with the write terms that may have
 * produced its value.
 */
public final class ReachingDefinitions {
    private static final ReachingDefinitions EMPTY = new ReachingDefinitions(Collections.emptyList());

    private final List<Chunk> chunks;

    private ReachingDefinitions(List<Chunk> chunks) {
        this.chunks = chunks;
    }

    public static ReachingDefinitions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /**
     * A part of the read location and its definitions.
     */
    public static final class Chunk {
        private final MemoryLocation location;
        private final List<Term> definitions;

        Chunk(MemoryLocation location, List<Term> definitions) {
            this.location = location;
            this.definitions = Collections.unmodifiableList(definitions);
        }

        public MemoryLocation location() {
            return location;
        }

        public List<Term> definitions() {
            return definitions;
        }
    }

    /**
     * Builds {@link ReachingDefinitions}.
     */
    public static final class Builder {
        private final List<MemoryLocation> locations = new ArrayList<>();
        private final List<List<Term>> definitions = new ArrayList<>();

        /**
         * Add a definition of a chunk. Definitions of the same location are grouped into one chunk.
         *
         * @param location   The chunk.
         * @param definition The write term.
         * @return This builder.
         */
        public Builder addDefinition(MemoryLocation location, Term definition) {
            if (!definition.isWrite()) {
                throw new IllegalArgumentException("definition " + definition + " is not a write");
            }
            int index = locations.indexOf(location);
            if (index < 0) {
                locations.add(location);
                definitions.add(new ArrayList<>());
                index = locations.size() - 1;
            }
            List<Term> chunkDefinitions = definitions.get(index);
            if (!chunkDefinitions.contains(definition)) {
                chunkDefinitions.add(definition);
            }
            return this;
        }

        public ReachingDefinitions build() {
            if (locations.isEmpty()) return EMPTY;
            List<Chunk> chunks = new ArrayList<>(locations.size());
            for (int i = 0; i < locations.size(); i++) {
                chunks.add(new Chunk(locations.get(i), definitions.get(i)));
            }
            return new ReachingDefinitions(Collections.unmodifiableList(chunks));
        }
    }
}
