package org.javai.shuuten.dispatch;

/**
 * A failed delivery attempt. Subclasses tell the retrier whether another attempt may help.
 */
public abstract sealed class DeliveryException extends Exception
        permits TransientDeliveryException, PermanentDeliveryException {

    protected DeliveryException(String message) {
        super(message);
    }

    protected DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
