package org.javai.shuuten.context;

/**
 * Raised by a {@link ContextProbe} that recognised an envelope but could not read it.
 * {@link ContextDetector} always catches it and falls through to the next probe.
 */
public class ContextDetectionException extends Exception {

    public ContextDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
