package org.javai.shuuten.retry;

import org.javai.shuuten.dispatch.DeliveryException;
import org.javai.shuuten.dispatch.TransientDeliveryException;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failed delivery.
 */
public interface RetryPolicy {

    /**
     * A short identifier for this policy, used in log lines.
     */
    String id();

    /**
     * @param context The current retry context
     * @param failure The exception raised by the attempt that just failed
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, DeliveryException failure);

    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, DeliveryException failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Exponential backoff over transient failures only. A server's retry-after hint wins when
     * it is longer than the computed delay, but is still capped at {@code maxDelay}.
     *
     * @param maxAttempts total attempts including the first
     */
    static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(initialDelay);
        Objects.requireNonNull(maxDelay);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, DeliveryException failure) {
                if (!failure.isRetryable()) {
                    return RetryDecision.GiveUp.because("failure is not retryable");
                }
                if (context.attemptNumber() >= maxAttempts) {
                    return RetryDecision.GiveUp.because("max attempts reached");
                }
                if (!context.hasBudgetRemaining()) {
                    return RetryDecision.GiveUp.because("budget exhausted");
                }

                // initialDelay * 2^(attempt-1), capped at maxDelay
                long multiplier = 1L << Math.min(context.attemptNumber() - 1, 30);
                Duration delay = initialDelay.multipliedBy(multiplier);

                if (failure instanceof TransientDeliveryException t && t.retryAfter() != null
                        && t.retryAfter().compareTo(delay) > 0) {
                    delay = t.retryAfter();
                }
                if (delay.compareTo(maxDelay) > 0) {
                    delay = maxDelay;
                }
                return RetryDecision.Retry.after(delay);
            }
        };
    }
}
