package io.github.eutro.nativedec.api;

import org.slf4j.LoggerFactory;

/**
 * Where the pipeline reports its progress, one status message per pass and per function.
 * <p>
 * Must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface LogToken {
    /**
     * A log token that writes to the SLF4J logger of the {@link Decompiler}, at info level.
     */
    LogToken SLF4J = LoggerFactory.getLogger(Decompiler.class)::info;

    void log(String message);
}
