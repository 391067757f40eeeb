package io.github.eutro.nativedec.api;

import io.github.eutro.nativedec.api.stage.Stage;
import io.github.eutro.nativedec.core.arch.Image;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The state of one decompilation job: its input image, its cancellation and
 * logging channels, and the stage of the last pass that completed.
 * <p>
 * Every artifact the pipeline has produced is reachable from {@link #getStage()}.
 * Only the {@link Decompiler} advances the stage.
 */
public final class AnalysisContext {
    private final Image image;
    private final CancellationToken cancellationToken;
    private final LogToken logToken;
    @Nullable
    private volatile Stage stage;

    /**
     * Construct a context that logs through SLF4J.
     *
     * @param image The image to decompile.
     */
    public AnalysisContext(@NotNull Image image) {
        this(image, new CancellationToken(), LogToken.SLF4J);
    }

    /**
     * Construct a context.
     *
     * @param image             The image to decompile.
     * @param cancellationToken The cancellation signal.
     * @param logToken          The progress sink.
     */
    public AnalysisContext(
            @NotNull Image image,
            @NotNull CancellationToken cancellationToken,
            @NotNull LogToken logToken
    ) {
        this.image = Objects.requireNonNull(image, "image");
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
        this.logToken = Objects.requireNonNull(logToken, "logToken");
    }

    public Image getImage() {
        return image;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public LogToken getLogToken() {
        return logToken;
    }

    /**
     * Get the stage of the last pass that completed.
     *
     * @return The stage, or null if no pass has completed.
     */
    public @Nullable Stage getStage() {
        return stage;
    }

    /**
     * Get the stage of the last pass that completed, if it is of the given type.
     *
     * @param stageClass The type of stage.
     * @param <S>        The type of stage.
     * @return The stage, or null if there is none or it is of another type.
     */
    public <S extends Stage> @Nullable S getStage(Class<S> stageClass) {
        Stage current = stage;
        return stageClass.isInstance(current) ? stageClass.cast(current) : null;
    }

    void advance(Stage next) {
        if (next.getContext() != this) {
            throw new IllegalArgumentException("stage belongs to another context");
        }
        stage = next;
    }
}
