package org.javai.shuuten;

import org.javai.shuuten.context.ContextToken;
import org.javai.shuuten.context.FakeLambdaContext;
import org.javai.shuuten.context.Source;
import org.javai.shuuten.dispatch.Destination;
import org.javai.shuuten.dispatch.RecordingDestination;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ShuutenRuntimeTest {

    private final RecordingDestination destination = RecordingDestination.delivering("recorder");
    private final List<Boolean> localCopies = new ArrayList<>();
    private ShuutenRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    static ShuutenConfig.Builder config() {
        return ShuutenConfig.builder()
                .app("billing")
                .env("test")
                .environment(Environment.empty())
                .systemProperties(new Properties());
    }

    private ShuutenRuntime start(ShuutenConfig config, boolean installAppender) {
        runtime = ShuutenRuntime.builder(config)
                .destinations(List.of(destination))
                .localSink((event, dispatched) -> localCopies.add(dispatched))
                .environment(Environment.empty())
                .installAppender(installAppender)
                .build();
        return runtime;
    }

    @Test
    void getLogger_errorWithExtras_reachesDestinations() {
        start(config().dedupWindow(Duration.ZERO).build(), true);

        runtime.getLogger("billing.jobs").event(Severity.ERROR, Map.of("invoice", "inv-9"), "Invoice {} rejected", "inv-9");

        assertThat(destination.received()).singleElement().satisfies(event -> {
            assertThat(event.message()).isEqualTo("Invoice inv-9 rejected");
            assertThat(event.messageTemplate()).isEqualTo("Invoice {} rejected");
            assertThat(event.loggerName()).isEqualTo("billing.jobs");
            assertThat(event.extra()).containsEntry("invoice", "inv-9");
        });
        assertThat(localCopies).containsExactly(true);
    }

    @Test
    void getLogger_belowThreshold_isNotForwarded() {
        start(config().build(), true);

        runtime.getLogger("billing.jobs").warning("Slow response from {}", "ledger");

        assertThat(destination.received()).isEmpty();
        assertThat(localCopies).isEmpty();
    }

    @Test
    void getLogger_repeatedFailure_isDispatchedOnceWithinWindow() {
        start(config().build(), true);
        EventLogger log = runtime.getLogger("billing.jobs");

        log.error("Ledger {} unreachable", "eu");
        log.error("Ledger {} unreachable", "eu");

        assertThat(destination.received()).hasSize(1);
        assertThat(localCopies).containsExactly(true, false);
    }

    @Test
    void close_detachesAppender() {
        start(config().dedupWindow(Duration.ZERO).build(), true);
        EventLogger log = runtime.getLogger("billing.jobs");

        runtime.close();
        log.critical("after close");

        assertThat(destination.received()).isEmpty();
        runtime = null;
    }

    @Test
    void notify_attachesCurrentContext() {
        start(config().build(), false);

        ContextToken token = runtime.detectAndSetContext(new FakeLambdaContext(), "nightly-billing");
        List<DestinationResult> results;
        try {
            results = runtime.notify(Severity.CRITICAL, "Disk full", new IllegalStateException("no space"));
        } finally {
            runtime.reset(token);
        }

        assertThat(results).singleElement().satisfies(result -> assertThat(result.success()).isTrue());
        assertThat(destination.received()).singleElement().satisfies(event -> {
            assertThat(event.loggerName()).isEqualTo("shuuten.notify");
            assertThat(event.contextSnapshot().source()).isEqualTo(Source.LAMBDA);
            assertThat(event.contextSnapshot().workflow()).isEqualTo("nightly-billing");
            assertThat(event.exceptionInfo().message()).isEqualTo("no space");
        });
        assertThat(runtime.contexts().depth()).isZero();
    }

    @Test
    void notify_withoutActiveContext_labelsEventWithConfiguredAppAndEnv() {
        start(config().build(), false);

        runtime.notify(Severity.ERROR, "Export failed", null);

        assertThat(destination.received()).singleElement().satisfies(event -> {
            assertThat(event.contextSnapshot().app()).isEqualTo("billing");
            assertThat(event.contextSnapshot().env()).isEqualTo("test");
            assertThat(event.contextSnapshot().source()).isEqualTo(Source.GENERIC);
        });
        assertThat(runtime.contexts().depth()).isZero();
    }

    @Test
    void notify_belowThreshold_returnsNoResults() {
        start(config().build(), false);

        assertThat(runtime.notify(Severity.INFO, "Nightly run started", null)).isEmpty();
        assertThat(destination.received()).isEmpty();
    }

    @Test
    void capture_isBoundToRuntimePipeline() {
        start(config().build(), false);

        assertThatThrownBy(() -> runtime.capture().workflow("nightly-billing").build().call(null, () -> {
            throw new ArithmeticException("/ by zero");
        })).isInstanceOf(ArithmeticException.class);

        assertThat(destination.received()).singleElement()
                .satisfies(event -> assertThat(event.extra()).containsEntry("workflow", "nightly-billing"));
    }

    @Test
    void destinationsFrom_unconfigured_yieldsDisabledSlackAndEmail() {
        List<Destination> destinations = ShuutenRuntime.destinationsFrom(config().build());

        assertThat(destinations).extracting(Destination::name).containsExactly("slack", "email");
        assertThat(destinations).noneMatch(Destination::isEnabled);
    }

    @Test
    void unconfiguredRuntime_reportsDisabledResultsAndStillWritesLocalCopy() {
        runtime = ShuutenRuntime.builder(config().build())
                .localSink((event, dispatched) -> localCopies.add(dispatched))
                .environment(Environment.empty())
                .installAppender(false)
                .build();

        List<DestinationResult> results = runtime.notify(Severity.CRITICAL, "Export failed", null);

        assertThat(results).extracting(DestinationResult::status)
                .containsExactly(DestinationResult.Status.DISABLED, DestinationResult.Status.DISABLED);
        assertThat(localCopies).containsExactly(true);
    }

    @Test
    void interceptorSettings_followConfig() {
        start(config().minLevel(Severity.WARNING).dedupWindow(Duration.ofMinutes(2)).emitLocalLog(false).build(), false);

        assertThat(runtime.interceptor().settings().minLevel()).isEqualTo(Severity.WARNING);
        assertThat(runtime.interceptor().settings().dedupWindow()).isEqualTo(Duration.ofMinutes(2));
        assertThat(runtime.interceptor().settings().emitLocalCopy()).isFalse();
        assertThat(runtime.destinations()).containsExactly(destination);
    }
}
