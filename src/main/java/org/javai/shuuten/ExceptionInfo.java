package org.javai.shuuten;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Exception details carried by a {@link LogEvent}.
 *
 * @param type The exception class name
 * @param message The exception message (may be null)
 * @param stackTrace The formatted stack trace, including causes
 */
public record ExceptionInfo(String type, String message, String stackTrace) {

    public ExceptionInfo {
        Objects.requireNonNull(type, "type must not be null");
        stackTrace = stackTrace == null ? "" : stackTrace;
    }

    public static ExceptionInfo fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return new ExceptionInfo(t.getClass().getName(), t.getMessage(), out.toString());
    }

    /**
     * Returns the simple class name, e.g. {@code ArithmeticException}.
     */
    public String simpleType() {
        int dot = type.lastIndexOf('.');
        return dot < 0 ? type : type.substring(dot + 1);
    }

    /**
     * Returns {@code Type: message}, or just the type when there is no message.
     */
    public String summary() {
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
