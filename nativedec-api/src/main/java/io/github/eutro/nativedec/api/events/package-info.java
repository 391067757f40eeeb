/**
 * Events that occur during a decompilation.
 * <p>
 * These can be used to report progress, to inspect the artifacts
 * produced by each pass, or to request cancellation.
 * <p>
 * The API revolves around {@link io.github.eutro.nativedec.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.nativedec.api.events;
