package org.javai.shuuten.ops.email;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.Severity;
import org.javai.shuuten.context.RuntimeContext;
import org.javai.shuuten.context.Source;
import org.javai.shuuten.dispatch.PermanentDeliveryException;
import org.javai.shuuten.dispatch.TransientDeliveryException;
import org.javai.shuuten.retry.DeliveryRetrier;
import org.javai.shuuten.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class EmailDestinationTest {

    private static final List<String> TO = List.of("ops@example.com");

    private static DeliveryRetrier fastRetrier() {
        return DeliveryRetrier.builder()
                .policy(RetryPolicy.exponentialBackoff("email", 3, Duration.ofMillis(10), Duration.ofMillis(50)))
                .sleeper(millis -> {})
                .build();
    }

    private static LogEvent event() {
        RuntimeContext context = new RuntimeContext("req-9", "billing", "prod", "nightly-billing", Source.LAMBDA,
                Map.of(), Instant.parse("2026-10-18T08:00:00Z"));
        return LogEvent.builder(Severity.CRITICAL, "Automation failed: ArithmeticException: / by zero")
                .loggerName("shuuten.capture")
                .extra("action", "BillingHandler")
                .exception(new ArithmeticException("/ by zero"))
                .context(context)
                .build();
    }

    @Test
    void send_rendersAndHandsMessageToTransport() {
        List<EmailMessage> sent = new ArrayList<>();
        EmailDestination destination = new EmailDestination("alerts@example.com", TO, List.of("team@example.com"),
                () -> sent::add, fastRetrier());

        DestinationResult result = destination.send(event());

        assertThat(result.success()).isTrue();
        assertThat(sent).singleElement().satisfies(message -> {
            assertThat(message.from()).isEqualTo("alerts@example.com");
            assertThat(message.to()).containsExactly("ops@example.com");
            assertThat(message.replyTo()).containsExactly("team@example.com");
            assertThat(message.subject()).isEqualTo("CRITICAL prod nightly-billing: BillingHandler");
            assertThat(message.textBody()).contains("run_id=req-9");
            assertThat(message.htmlBody()).contains("#8B0000");
        });
    }

    @Test
    void send_throttledThenAccepted_isRetried() {
        AtomicInteger calls = new AtomicInteger();
        EmailTransport flaky = message -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientDeliveryException("Throttling");
            }
        };
        EmailDestination destination = new EmailDestination("alerts@example.com", TO, List.of(), () -> flaky, fastRetrier());

        DestinationResult result = destination.send(event());

        assertThat(result.success()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void send_rejected_failsWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        EmailTransport rejecting = message -> {
            calls.incrementAndGet();
            throw new PermanentDeliveryException("Email address is not verified");
        };
        EmailDestination destination = new EmailDestination("alerts@example.com", TO, List.of(), () -> rejecting, fastRetrier());

        DestinationResult result = destination.send(event());

        assertThat(result.status()).isEqualTo(DestinationResult.Status.FAILED);
        assertThat(result.error()).contains("not verified");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void send_transportUnavailable_isFailedResult() {
        EmailDestination destination = new EmailDestination("alerts@example.com", TO, List.of(), () -> {
            throw new PermanentDeliveryException("SES email requires software.amazon.awssdk:ses on the classpath");
        }, fastRetrier());

        DestinationResult result = destination.send(event());

        assertThat(result.status()).isEqualTo(DestinationResult.Status.FAILED);
        assertThat(result.error()).contains("software.amazon.awssdk:ses");
    }

    @Test
    void transport_isCreatedOnceAndOnlyOnFirstSend() {
        AtomicInteger created = new AtomicInteger();
        EmailDestination destination = new EmailDestination("alerts@example.com", TO, List.of(), () -> {
            created.incrementAndGet();
            return message -> {};
        }, fastRetrier());

        assertThat(created.get()).isZero();
        destination.send(event());
        destination.send(event());
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void missingSenderOrRecipients_isDisabled() {
        EmailDestination noSender = new EmailDestination(null, TO, List.of(), message -> {});
        EmailDestination noRecipients = new EmailDestination("alerts@example.com", List.of(), List.of(), message -> {});

        assertThat(noSender.isEnabled()).isFalse();
        assertThat(noSender.disabledReason()).contains("sender");
        assertThat(noRecipients.isEnabled()).isFalse();
        assertThat(noRecipients.send(event()).status()).isEqualTo(DestinationResult.Status.DISABLED);
    }
}
