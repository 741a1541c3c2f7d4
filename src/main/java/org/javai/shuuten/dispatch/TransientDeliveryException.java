package org.javai.shuuten.dispatch;

import java.time.Duration;

/**
 * Network error, timeout, server error or rate limiting. Retried up to the policy's bound.
 */
public final class TransientDeliveryException extends DeliveryException {

    private final Duration retryAfter;

    public TransientDeliveryException(String message) {
        this(message, null, null);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        this(message, cause, null);
    }

    /**
     * @param retryAfter server-suggested delay before the next attempt (may be null)
     */
    public TransientDeliveryException(String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
