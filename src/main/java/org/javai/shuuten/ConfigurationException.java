package org.javai.shuuten;

/**
 * Thrown when a destination's required settings are missing or invalid.
 *
 * <p>Destinations built from {@link ShuutenConfig} catch this and stay disabled;
 * it is never fatal to the hosting process.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
