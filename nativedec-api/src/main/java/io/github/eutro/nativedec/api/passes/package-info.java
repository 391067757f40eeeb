/**
 * The passes of the decompiler pipeline, each turning one
 * {@link io.github.eutro.nativedec.api.stage.Stage stage} into the next.
 * <p>
 * A pass that returns null was cut short by cancellation.
 */
package io.github.eutro.nativedec.api.passes;
