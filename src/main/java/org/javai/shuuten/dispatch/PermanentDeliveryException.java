package org.javai.shuuten.dispatch;

/**
 * Authentication, validation or other rejection that another attempt will not fix.
 */
public final class PermanentDeliveryException extends DeliveryException {

    public PermanentDeliveryException(String message) {
        super(message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
