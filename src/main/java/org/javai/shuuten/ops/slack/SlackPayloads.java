package org.javai.shuuten.ops.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.SlackFormat;
import org.javai.shuuten.context.AwsLinks;
import org.javai.shuuten.context.RuntimeContext;
import org.javai.shuuten.ops.TextLimits;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds Slack incoming-webhook payloads for an event.
 *
 * <p>The blocks layout is: header, summary line, message (log events only), key fields,
 * links, exception (trimmed to its tail), remaining extras as JSON, divider.
 */
final class SlackPayloads {

	static final int HEADER_LIMIT = 150;
	static final int MESSAGE_LIMIT = 1800;
	static final int EXCEPTION_TAIL = 2500;
	static final int DETAILS_LIMIT = 1500;
	static final int MAX_FIELDS = 10;

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private SlackPayloads() {
		// Utility class
	}

	static String render(LogEvent event, SlackFormat format, String username) {
		ObjectNode payload = format == SlackFormat.PLAIN ? plain(event) : blocks(event);
		if (username != null && !username.isBlank()) {
			payload.put("username", username);
		}
		try {
			return MAPPER.writeValueAsString(payload);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialise Slack payload", e);
		}
	}

	static ObjectNode blocks(LogEvent event) {
		RuntimeContext context = event.contextSnapshot();
		String level = event.level().name();
		String action = action(event);

		ObjectNode payload = MAPPER.createObjectNode();
		String labels = labels(event);
		payload.put("text", level + ": " + fallbackText(event) + (labels.isEmpty() ? "" : " (" + labels + ")"));
		ArrayNode blocks = payload.putArray("blocks");

		String header;
		String topLine;
		if (event.hasException()) {
			header = "🚨 " + event.message();
			topLine = "*" + level + "* | `" + action + "`";
		} else {
			header = level + ": " + fallbackText(event);
			topLine = "`" + action + "`";
		}

		ObjectNode headerBlock = blocks.addObject().put("type", "header");
		headerBlock.putObject("text")
				.put("type", "plain_text")
				.put("text", truncate(header, HEADER_LIMIT))
				.put("emoji", true);
		section(blocks, topLine);

		if (!event.hasException() && !event.message().isEmpty()) {
			section(blocks, "*Message*\n```" + truncate(event.message(), MESSAGE_LIMIT) + "```");
		}

		List<String[]> fields = new ArrayList<>();
		addField(fields, "App", app(event));
		addField(fields, "Env", env(event));
		addField(fields, "Workflow", workflow(event));
		if (context != null) {
			addField(fields, "Run ID", context.invocationId());
			addField(fields, "Function", context.caller().get(RuntimeContext.FUNCTION_NAME));
			addField(fields, "Request ID", context.caller().get(RuntimeContext.REQUEST_ID));
			String account = context.caller().get(RuntimeContext.ACCOUNT_NAME);
			addField(fields, "Account", account != null ? account : context.caller().get(RuntimeContext.ACCOUNT_ID));
			addField(fields, "Region", context.caller().get(RuntimeContext.REGION));
			addField(fields, "Cluster", context.caller().get(RuntimeContext.CLUSTER));
		}
		addField(fields, "Logger", event.loggerName());
		if (!fields.isEmpty()) {
			ArrayNode fieldArray = blocks.addObject().put("type", "section").putArray("fields");
			fields.stream().limit(MAX_FIELDS).forEach(f -> fieldArray.addObject()
					.put("type", "mrkdwn")
					.put("text", "*" + f[0] + "*\n" + f[1]));
		}

		List<String> links = links(context);
		if (!links.isEmpty()) {
			section(blocks, String.join(" · ", links));
		}

		event.exception().ifPresent(info -> section(blocks,
				"*Exception*\n```" + tail(info.stackTrace().isEmpty() ? info.summary() : info.stackTrace(), EXCEPTION_TAIL) + "```"));

		Map<String, Object> details = details(event);
		if (!details.isEmpty()) {
			section(blocks, "*Details*\n```" + truncate(prettyJson(details), DETAILS_LIMIT) + "```");
		}

		blocks.addObject().put("type", "divider");
		return payload;
	}

	static ObjectNode plain(LogEvent event) {
		StringBuilder text = new StringBuilder()
				.append("🚨 *").append(event.message()).append("*\n")
				.append("*app*: ").append(app(event))
				.append(" | *env*: ").append(env(event))
				.append(" | *workflow*: ").append(nullToEmpty(workflow(event)))
				.append(" | *action*: ").append(action(event)).append('\n');
		RuntimeContext context = event.contextSnapshot();
		if (context != null) {
			text.append("*run_id*: ").append(context.invocationId()).append('\n');
			context.callerValue(RuntimeContext.LOG_URL)
					.ifPresent(url -> text.append("*logs*: ").append(url).append('\n'));
		}
		event.exception().ifPresent(info -> text.append("```")
				.append(tail(info.stackTrace().isEmpty() ? info.summary() : info.stackTrace(), EXCEPTION_TAIL))
				.append("```"));

		ObjectNode payload = MAPPER.createObjectNode();
		payload.put("text", text.toString());
		return payload;
	}

	private static void section(ArrayNode blocks, String markdown) {
		blocks.addObject()
				.put("type", "section")
				.putObject("text")
				.put("type", "mrkdwn")
				.put("text", markdown);
	}

	private static List<String> links(RuntimeContext context) {
		List<String> links = new ArrayList<>();
		if (context == null) {
			return links;
		}
		Map<String, String> caller = context.caller();
		if (caller.get(RuntimeContext.LOG_URL) != null) {
			links.add("<" + caller.get(RuntimeContext.LOG_URL) + "|CloudWatch Logs>");
		}
		String region = caller.get(RuntimeContext.REGION);
		String function = caller.get(RuntimeContext.FUNCTION_NAME);
		if (region != null && function != null) {
			links.add("<" + AwsLinks.lambdaFunction(region, function) + "|Lambda>");
		}
		if (caller.get(RuntimeContext.SOURCE_CODE) != null) {
			links.add("<" + caller.get(RuntimeContext.SOURCE_CODE) + "|Source>");
		}
		return links;
	}

	private static Map<String, Object> details(LogEvent event) {
		Map<String, Object> details = new LinkedHashMap<>(event.extra());
		details.remove("action");
		details.remove("workflow");
		return details;
	}

	private static void addField(List<String[]> fields, String label, String value) {
		if (value != null && !value.isBlank()) {
			fields.add(new String[] {label, value});
		}
	}

	static String action(LogEvent event) {
		Object action = event.extra().get("action");
		if (action != null) {
			return action.toString();
		}
		return event.loggerName().isEmpty() ? "log" : event.loggerName();
	}

	private static String workflow(LogEvent event) {
		Object workflow = event.extra().get("workflow");
		if (workflow != null) {
			return workflow.toString();
		}
		return event.contextSnapshot() == null ? null : event.contextSnapshot().workflow();
	}

	private static String app(LogEvent event) {
		return event.contextSnapshot() == null ? "" : nullToEmpty(event.contextSnapshot().app());
	}

	private static String labels(LogEvent event) {
		String app = app(event);
		String env = env(event);
		if (app.isEmpty() || env.isEmpty()) {
			return app + env;
		}
		return app + "/" + env;
	}

	private static String env(LogEvent event) {
		return event.contextSnapshot() == null ? "" : nullToEmpty(event.contextSnapshot().env());
	}

	private static String fallbackText(LogEvent event) {
		return event.message().isEmpty() ? "Shuuten notification" : event.message();
	}

	private static String prettyJson(Map<String, Object> value) {
		try {
			return PRETTY.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			return String.valueOf(value);
		}
	}

	static String truncate(String value, int limit) {
		return TextLimits.head(value, limit);
	}

	static String tail(String value, int limit) {
		return TextLimits.tail(value, limit);
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
