package org.javai.shuuten.ops.log4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.context.RuntimeContext;
import org.javai.shuuten.dispatch.LocalEventSink;

import java.util.Locale;
import java.util.Map;

/**
 * Writes the local copy of each event as a single JSON line through Log4j2.
 *
 * <p>Lines carry the {@link NotificationAppender#SHUUTEN} marker so the appender never feeds
 * them back into the pipeline. Suppressed duplicates are written too, flagged
 * {@code "dispatched": false}.
 */
public class Log4jLocalSink implements LocalEventSink {

	public static final String DEFAULT_LOGGER = "shuuten";
	static final String KIND = "shuuten.signal";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final Logger logger;

	public Log4jLocalSink() {
		this(LogManager.getLogger(DEFAULT_LOGGER));
	}

	public Log4jLocalSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void emit(LogEvent event, boolean dispatched) {
		logger.atLevel(event.level().toLog4j())
			.withMarker(NotificationAppender.SHUUTEN)
			.log(toJson(event, dispatched));
	}

	static String toJson(LogEvent event, boolean dispatched) {
		ObjectNode line = MAPPER.createObjectNode();
		line.put("kind", KIND);
		line.put("ts", event.timestamp().toString());
		line.put("level", event.level().name().toLowerCase(Locale.ROOT));
		line.put("logger", event.loggerName());
		line.put("msg", event.message());
		line.put("dispatched", dispatched);

		RuntimeContext context = event.contextSnapshot();
		if (context != null) {
			line.put("app", context.app());
			line.put("env", context.env());
			line.put("workflow", context.workflow());
			line.put("invocation_id", context.invocationId());
			line.put("source", context.source().name().toLowerCase(Locale.ROOT));
			if (!context.caller().isEmpty()) {
				line.set("caller", MAPPER.valueToTree(context.caller()));
			}
		}
		if (!event.extra().isEmpty()) {
			line.set("shuuten", toTree(event.extra()));
		}
		event.exception().ifPresent(info -> line.put("exc", info.stackTrace().isEmpty() ? info.summary() : info.stackTrace()));

		try {
			return MAPPER.writeValueAsString(line);
		} catch (JsonProcessingException e) {
			return "{\"kind\":\"" + KIND + "\",\"msg\":\"unserialisable event\"}";
		}
	}

	private static ObjectNode toTree(Map<String, Object> extra) {
		ObjectNode node = MAPPER.createObjectNode();
		extra.forEach((k, v) -> {
			try {
				node.set(k, MAPPER.valueToTree(v));
			} catch (IllegalArgumentException e) {
				node.put(k, String.valueOf(v));
			}
		});
		return node;
	}
}
