package io.github.eutro.nativedec.api.events;

import io.github.eutro.nativedec.api.AnalysisContext;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired just before a pass of the pipeline runs.
 * <p>
 * Requesting cancellation from a listener does not stop this pass,
 * but no pass after it will be started.
 */
public class PassEvent implements DecompileEvent {
    /**
     * The context being decompiled.
     */
    @NotNull
    public final AnalysisContext context;
    /**
     * The name of the pass, such as {@code dataflowAnalysis}.
     */
    @NotNull
    public final String passName;

    /**
     * Construct a new pass event.
     *
     * @param context  The context.
     * @param passName The name of the pass.
     */
    public PassEvent(@NotNull AnalysisContext context, @NotNull String passName) {
        this.context = context;
        this.passName = passName;
    }
}
