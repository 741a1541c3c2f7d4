package org.javai.shuuten.retry;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.dispatch.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a delivery attempt under a {@link RetryPolicy} and reports the final outcome as a
 * {@link DestinationResult}. Delivery exceptions never escape.
 *
 * <pre>{@code
 * DeliveryRetrier retrier = DeliveryRetrier.builder()
 *     .policy(RetryPolicy.exponentialBackoff("slack", 3, Duration.ofMillis(500), Duration.ofSeconds(4)))
 *     .budget(Duration.ofSeconds(20))
 *     .build();
 *
 * DestinationResult result = retrier.deliver("slack", () -> post(payload));
 * }</pre>
 */
public final class DeliveryRetrier {

    private static final Logger log = LoggerFactory.getLogger(DeliveryRetrier.class);

    private final RetryPolicy policy;
    private final Duration budget;
    private final Sleeper sleeper;

    private DeliveryRetrier(RetryPolicy policy, Duration budget, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.budget = budget;  // null means unlimited
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A retrier that makes exactly one attempt.
     */
    public static DeliveryRetrier once() {
        return builder().policy(RetryPolicy.noRetry()).build();
    }

    public static final class Builder {
        private RetryPolicy policy;
        private Duration budget;
        private Sleeper sleeper = Thread::sleep;

        private Builder() {}

        /**
         * Sets the retry policy (required).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets a time budget across all attempts (optional, defaults to unlimited).
         */
        public Builder budget(Duration budget) {
            this.budget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public DeliveryRetrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new DeliveryRetrier(policy, budget, sleeper);
        }
    }

    /**
     * Attempts delivery until it succeeds or the policy gives up.
     *
     * @param destination destination name recorded in the result
     * @param attempt one send; throws to signal failure
     */
    public DestinationResult deliver(String destination, DeliveryAttempt attempt) {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first(budget);
        while (true) {
            try {
                attempt.send();
                return DestinationResult.delivered(destination, context.attemptNumber());
            } catch (DeliveryException e) {
                RetryDecision decision = policy.decide(context, e);

                if (decision instanceof RetryDecision.GiveUp giveUp) {
                    log.debug("Giving up on {} after {} attempt(s) ({}): {}",
                            destination, context.attemptNumber(), giveUp.reason(), e.getMessage());
                    return DestinationResult.failed(destination, e.getMessage(), context.attemptNumber());
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                log.debug("Attempt {} to {} failed, retrying in {} [policy={}]: {}",
                        context.attemptNumber(), destination, delay, policy.id(), e.getMessage());
                if (!sleep(delay)) {
                    return DestinationResult.failed(destination, "interrupted: " + e.getMessage(), context.attemptNumber());
                }
                context = context.next();
            }
        }
    }

    private boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * One delivery attempt.
     */
    @FunctionalInterface
    public interface DeliveryAttempt {
        void send() throws DeliveryException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
