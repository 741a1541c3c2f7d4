package org.javai.shuuten.dedup;

import org.javai.shuuten.LogEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identifies "the same kind of event" for deduplication.
 *
 * <p>Derived from the logger name, the level, the message template and whether an exception
 * is attached. Interpolated argument values are deliberately excluded so repeated errors that
 * differ only in dynamic values collapse to one fingerprint. Messages logged without a stable
 * template (already-concatenated strings) therefore dedupe poorly.
 *
 * @param value SHA-1 hex digest
 */
public record Fingerprint(String value) {

    public Fingerprint {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Fingerprint of(LogEvent event) {
        String source = event.loggerName() + '\u0000'
                + event.level().name() + '\u0000'
                + event.messageTemplate() + '\u0000'
                + event.hasException();
        return new Fingerprint(sha1(source));
    }

    private static String sha1(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
