package io.github.eutro.nativedec.api.analysis;

import io.github.eutro.nativedec.api.CancellationToken;
import io.github.eutro.nativedec.core.arch.Image;
import io.github.eutro.nativedec.core.ir.Program;

/**
 * Lifts the instructions of an image into the IR.
 */
@FunctionalInterface
public interface ProgramGenerator {
    /**
     * Lift an image.
     *
     * @param image             The image.
     * @param cancellationToken The token to poll while lifting.
     * @return The lifted program.
     */
    Program generate(Image image, CancellationToken cancellationToken);
}
