/**
 * The decompiler pipeline over the core analyses.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.nativedec.api.Decompiler}, which decompiles an
 * {@link io.github.eutro.nativedec.api.AnalysisContext} using the external
 * analyzers it is given as {@link io.github.eutro.nativedec.api.analysis.Collaborators}.
 * <p>
 * Progress can be followed, and cancellation requested, using the
 * {@link io.github.eutro.nativedec.api.events events API}.
 */
package io.github.eutro.nativedec.api;
