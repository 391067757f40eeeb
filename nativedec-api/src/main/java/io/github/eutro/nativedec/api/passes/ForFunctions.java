package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.Functions;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs a per-function step over every function of a program, on the calling
 * thread or on an executor.
 * <p>
 * Cancellation is polled before each function is started. Functions that were
 * started are always finished.
 */
public class ForFunctions {
    @Nullable
    private final ExecutorService executor;

    /**
     * Construct a per-function runner.
     *
     * @param executor The executor to analyse functions on, or null to analyse them on the calling thread.
     */
    public ForFunctions(@Nullable ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * A runner that analyses functions on the calling thread.
     *
     * @return The runner.
     */
    public static ForFunctions sequential() {
        return new ForFunctions(null);
    }

    /**
     * Run a step over every function.
     *
     * @param context     The context, for cancellation and logging.
     * @param description What the step does, for status messages, such as {@code Dataflow analysis}.
     * @param functions   The functions.
     * @param step        The step.
     * @return Whether every function was processed, false if cancellation cut the run short.
     */
    public boolean run(AnalysisContext context, String description, Functions functions, Consumer<Function> step) {
        if (executor == null) {
            for (Function function : functions.list()) {
                if (context.getCancellationToken().isCancelled()) return false;
                runOne(context, description, function, step);
            }
            return true;
        }

        AtomicBoolean skipped = new AtomicBoolean();
        List<Future<?>> futures = new ArrayList<>(functions.size());
        for (Function function : functions.list()) {
            futures.add(executor.submit(() -> {
                if (context.getCancellationToken().isCancelled()) {
                    skipped.set(true);
                    return;
                }
                runOne(context, description, function, step);
            }));
        }
        Throwable failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (failure == null) failure = e.getCause();
                else failure.addSuppressed(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Future<?> toCancel : futures) toCancel.cancel(false);
                throw new CancellationException("interrupted while waiting for " + description);
            }
        }
        if (failure instanceof RuntimeException) throw (RuntimeException) failure;
        if (failure instanceof Error) throw (Error) failure;
        if (failure != null) throw new RuntimeException(failure);
        return !skipped.get();
    }

    private static void runOne(AnalysisContext context, String description, Function function, Consumer<Function> step) {
        context.getLogToken().log(description + " of " + function.getName() + ".");
        try {
            step.accept(function);
        } catch (Throwable t) {
            t.addSuppressed(new RuntimeException("in function " + function.getName()));
            throw t;
        }
    }
}
