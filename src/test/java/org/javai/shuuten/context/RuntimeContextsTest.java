package org.javai.shuuten.context;

import org.javai.shuuten.Environment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class RuntimeContextsTest {

    private RuntimeContexts contexts;

    @BeforeEach
    void setUp() {
        contexts = new RuntimeContexts(ContextDetector.builder()
                .app("billing")
                .env("prod")
                .environment(Environment.empty())
                .build());
    }

    private static RuntimeContext named(String id) {
        return new RuntimeContext(id, "billing", "prod", null, Source.GENERIC, Map.of(), Instant.now());
    }

    @Test
    void current_withNothingPushed_isEmpty() {
        assertThat(contexts.current()).isEmpty();
        assertThat(contexts.depth()).isZero();
    }

    @Test
    void currentOrDetected_prefersActiveContextAndNeverPushes() {
        RuntimeContext detected = contexts.currentOrDetected();

        assertThat(detected.app()).isEqualTo("billing");
        assertThat(detected.env()).isEqualTo("prod");
        assertThat(contexts.depth()).isZero();

        ContextToken token = contexts.setContext(named("active"));
        assertThat(contexts.currentOrDetected().invocationId()).isEqualTo("active");
        contexts.reset(token);
    }

    @Test
    void nestedContexts_resetRestoresEnclosingContext() {
        ContextToken outer = contexts.setContext(named("outer"));
        ContextToken inner = contexts.setContext(named("inner"));

        assertThat(contexts.current()).map(RuntimeContext::invocationId).contains("inner");

        contexts.reset(inner);
        assertThat(contexts.current()).map(RuntimeContext::invocationId).contains("outer");

        contexts.reset(outer);
        assertThat(contexts.current()).isEmpty();
    }

    @Test
    void reset_sameTokenTwice_isNoOp() {
        ContextToken outer = contexts.setContext(named("outer"));
        ContextToken inner = contexts.setContext(named("inner"));

        contexts.reset(inner);
        contexts.reset(inner);

        assertThat(contexts.current()).map(RuntimeContext::invocationId).contains("outer");
        contexts.reset(outer);
    }

    @Test
    void reset_outerToken_discardsInnerFrames() {
        ContextToken outer = contexts.setContext(named("outer"));
        ContextToken inner = contexts.setContext(named("inner"));

        contexts.reset(outer);
        assertThat(contexts.current()).isEmpty();

        contexts.reset(inner);
        assertThat(contexts.current()).isEmpty();
    }

    @Test
    void reset_null_isNoOp() {
        contexts.setContext(named("only"));

        contexts.reset(null);

        assertThat(contexts.depth()).isEqualTo(1);
    }

    @Test
    void detectAndSetContext_tagsWorkflow() {
        ContextToken token = contexts.detectAndSetContext(null, "nightly-billing");
        try {
            assertThat(contexts.current()).map(RuntimeContext::workflow).contains("nightly-billing");
            assertThat(token.context().source()).isEqualTo(Source.GENERIC);
        } finally {
            contexts.reset(token);
        }
    }

    @Test
    void scope_closesOnExit() {
        try (ContextScope scope = contexts.open(named("scoped"))) {
            assertThat(contexts.current()).contains(scope.context());
        }
        assertThat(contexts.current()).isEmpty();
    }

    @Test
    void otherThreads_doNotSeeThisThreadsContext() throws Exception {
        ContextToken token = contexts.setContext(named("main"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Optional<RuntimeContext> seen = executor.submit(() -> contexts.current()).get();
            assertThat(seen).isEmpty();

            executor.submit(() -> contexts.reset(token)).get();
            assertThat(contexts.current()).map(RuntimeContext::invocationId).contains("main");
        } finally {
            executor.shutdownNow();
            contexts.reset(token);
        }
    }

    @Test
    void concurrentThreads_keepIndependentStacks() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Callable<String> worker1 = () -> {
                ContextToken token = contexts.setContext(named("w1"));
                try {
                    Thread.sleep(20);
                    return contexts.current().map(RuntimeContext::invocationId).orElse("none");
                } finally {
                    contexts.reset(token);
                }
            };
            Callable<String> worker2 = () -> {
                ContextToken token = contexts.setContext(named("w2"));
                try {
                    Thread.sleep(20);
                    return contexts.current().map(RuntimeContext::invocationId).orElse("none");
                } finally {
                    contexts.reset(token);
                }
            };

            var first = executor.submit(worker1);
            var second = executor.submit(worker2);

            assertThat(first.get()).isEqualTo("w1");
            assertThat(second.get()).isEqualTo("w2");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void propagating_carriesContextIntoExecutorTask() throws Exception {
        ContextToken token = contexts.setContext(named("parent"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            AtomicReference<String> seen = new AtomicReference<>();
            executor.submit(contexts.propagating(() ->
                    seen.set(contexts.current().map(RuntimeContext::invocationId).orElse("none")))).get();

            assertThat(seen.get()).isEqualTo("parent");
            // the worker's stack is unwound afterwards
            assertThat(executor.submit(() -> contexts.depth()).get()).isZero();
        } finally {
            executor.shutdownNow();
            contexts.reset(token);
        }
    }
}
