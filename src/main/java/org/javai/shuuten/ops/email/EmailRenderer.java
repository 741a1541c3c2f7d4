package org.javai.shuuten.ops.email;

import org.javai.shuuten.LogEvent;
import org.javai.shuuten.Severity;
import org.javai.shuuten.context.AwsLinks;
import org.javai.shuuten.context.RuntimeContext;
import org.javai.shuuten.ops.TextLimits;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders an event as an email subject plus plain-text and HTML bodies.
 *
 * <p>Every interpolated value in the HTML body is escaped. Exception traces keep their last
 * {@value #EXCEPTION_TAIL} characters.
 */
public final class EmailRenderer {

	static final int EXCEPTION_TAIL = 12000;

	private static final String ROW = "<tr>"
			+ "<td style=\"padding:6px 10px;color:#555;font-size:12px;vertical-align:top;white-space:nowrap;\"><b>%s</b></td>"
			+ "<td style=\"padding:6px 10px;color:#111;font-size:12px;vertical-align:top;\">%s</td>"
			+ "</tr>";
	private static final String TABLE =
			"<table style=\"border-collapse:collapse;width:100%%;background:#fff;border:1px solid #eee;\">%s</table>";
	private static final String HEADING = "<h3 style=\"margin:16px 0 8px 0;\">%s</h3>";

	private EmailRenderer() {
		// Utility class
	}

	/**
	 * {@code LEVEL env workflow: action}
	 */
	public static String subject(LogEvent event) {
		StringBuilder subject = new StringBuilder(event.level().name());
		String env = env(event);
		if (!env.isEmpty()) {
			subject.append(' ').append(env);
		}
		String workflow = workflow(event);
		if (workflow != null && !workflow.isBlank()) {
			subject.append(' ').append(workflow);
		}
		return subject.append(": ").append(action(event)).toString().replaceAll("[\\r\\n]+", " ");
	}

	public static String text(LogEvent event) {
		StringBuilder text = new StringBuilder();
		RuntimeContext context = event.contextSnapshot();
		text.append(event.message()).append('\n');
		text.append("level=").append(event.level())
				.append(" app=").append(app(event))
				.append(" env=").append(env(event))
				.append(" workflow=").append(nullToEmpty(workflow(event)))
				.append(" action=").append(action(event)).append('\n');
		if (context != null) {
			text.append("run_id=").append(context.invocationId()).append('\n');
			context.callerValue(RuntimeContext.LOG_URL).ifPresent(url -> text.append("logs: ").append(url).append('\n'));
			if (!context.caller().isEmpty()) {
				text.append("source:\n");
				context.caller().forEach((k, v) -> text.append("  ").append(k).append(": ").append(v).append('\n'));
			}
		}
		if (!event.extra().isEmpty()) {
			text.append("context:\n");
			event.extra().forEach((k, v) -> text.append("  ").append(k).append(": ").append(v).append('\n'));
		}
		event.exception().ifPresent(info -> text.append('\n').append("exception:\n").append(exceptionText(info.stackTrace(), info.summary())));
		return text.toString();
	}

	public static String html(LogEvent event) {
		RuntimeContext context = event.contextSnapshot();

		StringBuilder summary = new StringBuilder();
		summary.append(row("Level", event.level().name()));
		summary.append(row("App", app(event)));
		summary.append(row("Env", env(event)));
		summary.append(row("Workflow", nullToEmpty(workflow(event))));
		summary.append(row("Action", action(event)));
		summary.append(row("Logger", event.loggerName()));
		if (context != null) {
			summary.append(row("Run ID", context.invocationId()));
		}
		summary.append(row("Timestamp", event.timestamp().toString()));

		StringBuilder html = new StringBuilder();
		html.append("<html><body style=\"font-family:Arial, sans-serif;background:#f6f7f9;padding:16px;\">")
				.append("<div style=\"max-width:720px;margin:0 auto;background:#fff;border:1px solid #e6e6e6;border-radius:10px;overflow:hidden;\">")
				.append("<div style=\"background:").append(levelColor(event.level())).append(";color:#fff;padding:12px 16px;\">")
				.append("<div style=\"font-size:16px;font-weight:700;\">").append(escape(event.message())).append("</div>")
				.append("<div style=\"font-size:12px;opacity:0.9;\">")
				.append(escape(event.level().name() + " · " + app(event) + " · " + env(event) + " · " + nullToEmpty(workflow(event)) + " · " + action(event)))
				.append("</div></div>")
				.append("<div style=\"padding:16px;\">")
				.append("<h3 style=\"margin:0 0 8px 0;\">Summary</h3>")
				.append(TABLE.formatted(summary));

		String links = links(context);
		if (!links.isEmpty()) {
			html.append(HEADING.formatted("Links")).append(links);
		}

		html.append(HEADING.formatted("Source")).append(table(context == null ? Map.of() : context.caller()));
		html.append(HEADING.formatted("Context")).append(table(event.extra()));

		event.exception().ifPresent(info -> html.append(HEADING.formatted("Exception"))
				.append("<pre style=\"white-space:pre-wrap;background:#0b0b0b;color:#f5f5f5;padding:12px;border-radius:6px;font-size:12px;overflow:auto;\">")
				.append(escape(exceptionText(info.stackTrace(), info.summary())))
				.append("</pre>"));

		html.append("</div></div></body></html>");
		return html.toString();
	}

	static String levelColor(Severity level) {
		return switch (level) {
			case DEBUG -> "#1E90FF";
			case INFO -> "#2E8B57";
			case WARNING -> "#FF8C00";
			case ERROR -> "#FF0000";
			case CRITICAL -> "#8B0000";
		};
	}

	static String escape(String value) {
		if (value == null) {
			return "";
		}
		StringBuilder out = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '&' -> out.append("&amp;");
				case '<' -> out.append("&lt;");
				case '>' -> out.append("&gt;");
				case '"' -> out.append("&quot;");
				case '\'' -> out.append("&#x27;");
				default -> out.append(c);
			}
		}
		return out.toString();
	}

	private static String links(RuntimeContext context) {
		if (context == null) {
			return "";
		}
		Map<String, String> targets = new LinkedHashMap<>();
		context.callerValue(RuntimeContext.LOG_URL).ifPresent(url -> targets.put("CloudWatch Logs", url));
		String region = context.caller().get(RuntimeContext.REGION);
		String function = context.caller().get(RuntimeContext.FUNCTION_NAME);
		if (region != null && function != null) {
			targets.put("Lambda", AwsLinks.lambdaFunction(region, function));
		}
		context.callerValue(RuntimeContext.SOURCE_CODE).ifPresent(url -> targets.put("Source", url));

		StringBuilder links = new StringBuilder();
		targets.forEach((label, url) -> links.append("<div style=\"margin:6px 0;\"><a href=\"")
				.append(escape(url)).append("\">").append(escape(label)).append("</a></div>"));
		return links.toString();
	}

	private static String table(Map<String, ?> values) {
		if (values.isEmpty()) {
			return "<i>none</i>";
		}
		StringBuilder rows = new StringBuilder();
		values.forEach((k, v) -> rows.append(row(k, String.valueOf(v))));
		return TABLE.formatted(rows);
	}

	private static String row(String key, String value) {
		return ROW.formatted(escape(key), escape(value));
	}

	private static String exceptionText(String stackTrace, String summary) {
		String text = stackTrace == null || stackTrace.isEmpty() ? summary : stackTrace;
		return TextLimits.tail(text, EXCEPTION_TAIL);
	}

	private static String action(LogEvent event) {
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

	private static String env(LogEvent event) {
		return event.contextSnapshot() == null ? "" : nullToEmpty(event.contextSnapshot().env());
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
