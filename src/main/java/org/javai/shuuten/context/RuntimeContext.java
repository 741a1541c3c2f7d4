package org.javai.shuuten.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Metadata describing one logical invocation.
 *
 * @param invocationId Provider-assigned request id, or a generated UUID
 * @param app Application label
 * @param env Environment label
 * @param workflow Free-form workflow label (may be null)
 * @param source The detected host kind
 * @param caller Provider-specific identifying fields, keyed by the constants in this class
 * @param createdAt When the context was created
 */
public record RuntimeContext(
        String invocationId,
        String app,
        String env,
        String workflow,
        Source source,
        Map<String, String> caller,
        Instant createdAt
) {

    public static final String FUNCTION_NAME = "function_name";
    public static final String FUNCTION_ARN = "function_arn";
    public static final String REQUEST_ID = "request_id";
    public static final String LOG_GROUP = "log_group";
    public static final String LOG_STREAM = "log_stream";
    public static final String REGION = "region";
    public static final String ACCOUNT_ID = "account_id";
    public static final String ACCOUNT_NAME = "account_name";
    public static final String CLUSTER = "cluster";
    public static final String TASK_ARN = "task_arn";
    public static final String SOURCE_CODE = "source_code";
    public static final String LOG_URL = "log_url";

    public RuntimeContext {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        invocationId = invocationId == null || invocationId.isBlank() ? UUID.randomUUID().toString() : invocationId;
        if (caller == null || caller.isEmpty()) {
            caller = Map.of();
        } else {
            Map<String, String> copy = new LinkedHashMap<>();
            caller.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
            caller = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * A generic context with no provider metadata.
     */
    public static RuntimeContext generic(String app, String env) {
        return new RuntimeContext(null, app, env, null, Source.GENERIC, Map.of(), Instant.now());
    }

    public RuntimeContext withWorkflow(String workflow) {
        return new RuntimeContext(invocationId, app, env, workflow, source, caller, createdAt);
    }

    public Optional<String> callerValue(String key) {
        return Optional.ofNullable(caller.get(key));
    }
}
