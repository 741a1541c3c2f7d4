package org.javai.shuuten.context;

import org.javai.shuuten.Environment;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A structural check that recognises one kind of host from the invocation envelope
 * and the process environment.
 */
public interface ContextProbe {

    /**
     * The source this probe recognises.
     */
    Source source();

    /**
     * Inspects the envelope and environment.
     *
     * @param envelope the platform-supplied context object, a map, or null
     * @param environment process environment
     * @return the identifying fields if recognised, otherwise empty
     * @throws ContextDetectionException if the shape matched but its fields could not be read
     */
    Optional<Detection> probe(Object envelope, Environment environment) throws ContextDetectionException;

    /**
     * The fields a probe extracted.
     *
     * @param invocationId Provider request/task id (may be null)
     * @param caller Identifying metadata keyed by {@link RuntimeContext} constants
     */
    record Detection(String invocationId, Map<String, String> caller) {
        public Detection {
            caller = caller == null ? Map.of() : caller;
        }
    }

    /**
     * Reads the first non-blank string value found under any of the keys.
     */
    static String firstString(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null && !Objects.toString(value).isBlank()) {
                return Objects.toString(value);
            }
        }
        return null;
    }

    /**
     * Returns the colon-separated ARN segment at {@code index}, or null.
     * ARNs look like {@code arn:aws:lambda:us-east-1:123456789012:function:name}.
     */
    static String arnSegment(String arn, int index) {
        if (arn == null) {
            return null;
        }
        String[] parts = arn.split(":");
        if (parts.length <= index || parts[index].isBlank()) {
            return null;
        }
        return parts[index];
    }
}
