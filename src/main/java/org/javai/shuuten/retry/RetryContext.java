package org.javai.shuuten.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * State handed to a retry policy after each failed attempt.
 *
 * @param attemptNumber The attempt that just failed (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt
 * @param budget Total time allowed for all attempts (null if unbounded)
 */
public record RetryContext(
        int attemptNumber,
        Instant startedAt,
        Duration elapsed,
        Duration budget
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Duration budget) {
        return new RetryContext(1, Instant.now(), Duration.ZERO, budget);
    }

    public RetryContext next() {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, Instant.now()), budget);
    }

    public boolean hasBudgetRemaining() {
        return budget == null || budget.compareTo(elapsed) > 0;
    }
}
