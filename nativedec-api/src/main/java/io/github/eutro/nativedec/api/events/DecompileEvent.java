package io.github.eutro.nativedec.api.events;

import io.github.eutro.nativedec.api.Decompiler;

/**
 * An event fired on a {@link Decompiler} while it decompiles.
 */
public interface DecompileEvent {
}
