package org.javai.shuuten;

import java.util.Map;

/**
 * Read access to process environment variables.
 */
@FunctionalInterface
public interface Environment {

    /**
     * Returns the variable's value, or null if it is not set.
     */
    String get(String name);

    /**
     * Returns the value, or null if unset or blank.
     */
    default String getNonBlank(String name) {
        String value = get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    static Environment system() {
        return System::getenv;
    }

    static Environment of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return copy::get;
    }

    static Environment empty() {
        return name -> null;
    }
}
