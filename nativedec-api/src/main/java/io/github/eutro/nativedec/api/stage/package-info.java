/**
 * The typed stages the decompiler pipeline threads from pass to pass.
 * <p>
 * Stages form a chain of subclasses, from
 * {@link io.github.eutro.nativedec.api.stage.ProgramStage} to
 * {@link io.github.eutro.nativedec.api.stage.CompletedStage},
 * each adding the artifact of one pass.
 */
package io.github.eutro.nativedec.api.stage;
