package io.github.eutro.nativedec.api.passes;

import io.github.eutro.nativedec.api.AnalysisContext;
import io.github.eutro.nativedec.api.CancellationToken;
import io.github.eutro.nativedec.core.arch.Architecture;
import io.github.eutro.nativedec.core.arch.Demangler;
import io.github.eutro.nativedec.core.arch.Image;
import io.github.eutro.nativedec.core.arch.Instructions;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.Functions;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ForFunctionsTest {
    private static final Image IMAGE = new Image() {
        private final Instructions instructions = new Instructions();

        @Override
        public Architecture getArchitecture() {
            return Architecture.GENERIC;
        }

        @Override
        public @Nullable String getName(long address) {
            return null;
        }

        @Override
        public Demangler getDemangler() {
            return Demangler.NONE;
        }

        @Override
        public Instructions getInstructions() {
            return instructions;
        }
    };

    private final CancellationToken token = new CancellationToken();
    private final List<String> messages = Collections.synchronizedList(new ArrayList<>());
    private final AnalysisContext context = new AnalysisContext(IMAGE, token, messages::add);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private static Functions functions(int count) {
        Functions functions = new Functions();
        for (int i = 0; i < count; i++) {
            Function function = new Function();
            function.setName("f" + i);
            functions.add(function);
        }
        return functions;
    }

    @Test
    void sequentialRunsInOrder() {
        List<String> seen = new ArrayList<>();
        assertTrue(ForFunctions.sequential().run(context, "Counting", functions(3), f -> seen.add(f.getName())));
        assertEquals(Arrays.asList("f0", "f1", "f2"), seen);
        assertEquals(Arrays.asList("Counting of f0.", "Counting of f1.", "Counting of f2."), messages);
    }

    @Test
    void sequentialStopsOnCancellation() {
        List<String> seen = new ArrayList<>();
        assertFalse(ForFunctions.sequential().run(context, "Counting", functions(3), f -> {
            seen.add(f.getName());
            token.cancel();
        }));
        assertEquals(Arrays.asList("f0"), seen);
    }

    @Test
    void parallelVisitsEveryFunction() {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        assertTrue(new ForFunctions(executor).run(context, "Counting", functions(32), f -> seen.add(f.getName())));
        assertEquals(32, seen.size());
    }

    @Test
    void parallelCancelledBeforeStart() {
        token.cancel();
        Set<String> seen = ConcurrentHashMap.newKeySet();
        assertFalse(new ForFunctions(executor).run(context, "Counting", functions(8), f -> seen.add(f.getName())));
        assertTrue(seen.isEmpty());
    }

    @Test
    void failuresAreCollected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ForFunctions(executor).run(context, "Counting", functions(4), f -> {
                    if (!f.getName().equals("f1")) throw new IllegalArgumentException(f.getName());
                }));
        // the first failing function in list order carries the others
        assertEquals("f0", e.getMessage());
        assertEquals("in function f0", e.getSuppressed()[0].getMessage());
        assertEquals(3, e.getSuppressed().length);
    }
}
