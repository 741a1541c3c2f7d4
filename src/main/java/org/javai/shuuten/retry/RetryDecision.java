package org.javai.shuuten.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry policy after a failed delivery attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Attempt delivery again after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop; the delivery is recorded as failed.
     */
    record GiveUp(String reason) implements RetryDecision {
        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }
    }
}
