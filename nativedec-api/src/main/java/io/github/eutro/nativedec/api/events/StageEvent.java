package io.github.eutro.nativedec.api.events;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.api.stage.Stage;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when a pass completes, after its stage is recorded in the context.
 */
public class StageEvent implements DecompileEvent {
    /**
     * The context being decompiled.
     */
    @NotNull
    public final AnalysisContext context;
    /**
     * The name of the pass that completed.
     */
    @NotNull
    public final String passName;
    /**
     * The stage the pass produced.
     */
    @NotNull
    public final Stage stage;

    /**
     * Construct a new stage event.
     *
     * @param context  The context.
     * @param passName The name of the pass.
     * @param stage    The stage.
     */
    public StageEvent(@NotNull AnalysisContext context, @NotNull String passName, @NotNull Stage stage) {
        this.context = context;
        this.passName = passName;
        this.stage = stage;
    }
}
