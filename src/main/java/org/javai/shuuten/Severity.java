package org.javai.shuuten;

import org.apache.logging.log4j.Level;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered severity of a {@link LogEvent}.
 *
 * <p>The numeric values follow the conventional 10/20/30/40/50 scale so that
 * thresholds can be supplied either by name or by number.
 */
public enum Severity {
    DEBUG(10),
    INFO(20),
    WARNING(30),
    ERROR(40),
    CRITICAL(50);

    private final int value;

    Severity(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Returns true if this severity is at or above the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return value >= threshold.value;
    }

    /**
     * Parses a severity name ({@code warn} and {@code fatal} accepted) or a numeric level.
     *
     * @return the severity, or empty if the text is not recognised
     */
    public static Optional<Severity> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "WARN":
                return Optional.of(WARNING);
            case "FATAL":
                return Optional.of(CRITICAL);
            case "TRACE":
                return Optional.of(DEBUG);
            default:
                break;
        }
        for (Severity severity : values()) {
            if (severity.name().equals(normalized) || String.valueOf(severity.value).equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a Log4j2 level onto the severity scale. Levels below DEBUG map to DEBUG.
     */
    public static Severity fromLog4j(Level level) {
        if (level.isMoreSpecificThan(Level.FATAL)) {
            return CRITICAL;
        }
        if (level.isMoreSpecificThan(Level.ERROR)) {
            return ERROR;
        }
        if (level.isMoreSpecificThan(Level.WARN)) {
            return WARNING;
        }
        if (level.isMoreSpecificThan(Level.INFO)) {
            return INFO;
        }
        return DEBUG;
    }

    public Level toLog4j() {
        return switch (this) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR -> Level.ERROR;
            case CRITICAL -> Level.FATAL;
        };
    }
}
