package org.javai.shuuten.ops;

import org.javai.shuuten.ExceptionInfo;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.context.RuntimeContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets before an event leaves the process.
 *
 * <p>Values under sensitive keys are replaced with {@code [REDACTED]} at any nesting depth,
 * bearer tokens embedded in strings are masked, and long strings are truncated. Exception
 * traces are masked but not truncated; formatters trim them to fit their payload limits.
 */
public final class Redactor {

	public static final String REDACTED = "[REDACTED]";
	public static final String TRUNCATED = "…[TRUNCATED]";
	public static final int DEFAULT_MAX_LENGTH = 4000;

	public static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
			"token", "access_token", "refresh_token", "id_token",
			"auth", "authorization",
			"password", "pwd", "passphrase",
			"secret", "client_secret", "secret_key", "private_key",
			"api_key", "x-api-key", "x_api_key",
			"cookie", "set-cookie", "set_cookie", "session",
			"aws_access_key_id", "aws_secret_access_key", "aws_session_token"
	);

	private static final Pattern BEARER = Pattern.compile("(?i)\\bBearer\\s+[A-Za-z0-9\\-_.=]+");

	private final Set<String> sensitiveKeys;
	private final int maxLength;

	public Redactor() {
		this(DEFAULT_SENSITIVE_KEYS, DEFAULT_MAX_LENGTH);
	}

	public Redactor(Set<String> sensitiveKeys, int maxLength) {
		this.sensitiveKeys = Set.copyOf(sensitiveKeys);
		this.maxLength = maxLength;
	}

	/**
	 * Returns a copy of the event with its message, extras, exception and caller metadata masked.
	 */
	public LogEvent redact(LogEvent event) {
		ExceptionInfo exception = event.exceptionInfo();
		if (exception != null) {
			exception = new ExceptionInfo(exception.type(),
					exception.message() == null ? null : redactString(exception.message()),
					maskBearer(exception.stackTrace()));
		}
		RuntimeContext context = event.contextSnapshot();
		if (context != null && !context.caller().isEmpty()) {
			Map<String, String> caller = new LinkedHashMap<>();
			context.caller().forEach((k, v) -> caller.put(k, isSensitive(k) ? REDACTED : redactString(v)));
			context = new RuntimeContext(context.invocationId(), context.app(), context.env(),
					context.workflow(), context.source(), caller, context.createdAt());
		}
		return new LogEvent(
				event.level(),
				redactString(event.message()),
				event.messageTemplate(),
				event.timestamp(),
				event.loggerName(),
				exception,
				redactMap(event.extra()),
				context);
	}

	/**
	 * Masks any value: maps by key, collections element-wise, strings by pattern and length.
	 */
	public Object redactValue(Object value) {
		if (value instanceof String s) {
			return redactString(s);
		}
		if (value instanceof Map<?, ?> map) {
			return redactMap(map);
		}
		if (value instanceof Collection<?> collection) {
			List<Object> out = new ArrayList<>(collection.size());
			for (Object element : collection) {
				out.add(redactValue(element));
			}
			return out;
		}
		return value;
	}

	public String redactString(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		String masked = maskBearer(value);
		if (masked.length() > maxLength) {
			return TextLimits.head(masked, maxLength) + TRUNCATED;
		}
		return masked;
	}

	private Map<String, Object> redactMap(Map<?, ?> map) {
		Map<String, Object> out = new LinkedHashMap<>();
		map.forEach((k, v) -> {
			String key = String.valueOf(k);
			out.put(key, isSensitive(key) ? REDACTED : redactValue(v));
		});
		return out;
	}

	private boolean isSensitive(String key) {
		return sensitiveKeys.contains(key.toLowerCase(Locale.ROOT));
	}

	private static String maskBearer(String value) {
		return BEARER.matcher(value).replaceAll(Matcher.quoteReplacement("Bearer " + REDACTED));
	}
}
