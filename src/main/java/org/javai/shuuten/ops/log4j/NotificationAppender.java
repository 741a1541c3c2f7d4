package org.javai.shuuten.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.message.Message;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.Severity;
import org.javai.shuuten.context.RuntimeContexts;
import org.javai.shuuten.dispatch.EventInterceptor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Forwards application log events at or above the interceptor's threshold into the
 * notification pipeline.
 *
 * <p>Attached programmatically to the root logger by {@link #install()}. Events marked
 * {@link #SHUUTEN}, events from this library's own loggers and events raised while this
 * appender is already forwarding on the same thread are ignored, so a failing destination
 * that logs can never loop back into itself.
 */
public final class NotificationAppender extends AbstractAppender {

	public static final String NAME = "ShuutenNotifications";
	public static final Marker SHUUTEN = MarkerManager.getMarker("SHUUTEN");

	static final String INTERNAL_LOGGER_PREFIX = "org.javai.shuuten.";

	private static final ThreadLocal<Boolean> FORWARDING = ThreadLocal.withInitial(() -> Boolean.FALSE);

	private final EventInterceptor interceptor;
	private final RuntimeContexts contexts;

	public NotificationAppender(EventInterceptor interceptor, RuntimeContexts contexts) {
		super(NAME, null, null, true, Property.EMPTY_ARRAY);
		this.interceptor = Objects.requireNonNull(interceptor, "interceptor must not be null");
		this.contexts = Objects.requireNonNull(contexts, "contexts must not be null");
	}

	/**
	 * Starts the appender and attaches it to the root logger of the current logger context.
	 */
	public void install() {
		LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
		Configuration config = ctx.getConfiguration();
		start();
		config.addAppender(this);
		config.getRootLogger().addAppender(this, null, null);
		ctx.updateLoggers();
	}

	/**
	 * Detaches and stops the appender.
	 */
	public void uninstall() {
		LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
		Configuration config = ctx.getConfiguration();
		config.getRootLogger().removeAppender(NAME);
		ctx.updateLoggers();
		stop();
	}

	@Override
	public void append(org.apache.logging.log4j.core.LogEvent event) {
		if (!accepts(event) || FORWARDING.get()) {
			return;
		}
		FORWARDING.set(Boolean.TRUE);
		try {
			interceptor.handle(convert(event));
		} catch (RuntimeException e) {
			error("Unable to forward log event from " + event.getLoggerName(), event, e);
		} finally {
			FORWARDING.set(Boolean.FALSE);
		}
	}

	boolean accepts(org.apache.logging.log4j.core.LogEvent event) {
		if (event.getMarker() != null && event.getMarker().isInstanceOf(SHUUTEN)) {
			return false;
		}
		String loggerName = event.getLoggerName();
		if (loggerName != null && loggerName.startsWith(INTERNAL_LOGGER_PREFIX)) {
			return false;
		}
		return Severity.fromLog4j(event.getLevel()).isAtLeast(interceptor.settings().minLevel());
	}

	LogEvent convert(org.apache.logging.log4j.core.LogEvent event) {
		Message message = event.getMessage();
		String formatted = message == null ? "" : message.getFormattedMessage();
		String template = message == null ? null : message.getFormat();

		Map<String, Object> extra = new LinkedHashMap<>();
		if (event.getContextData() != null && !event.getContextData().isEmpty()) {
			extra.putAll(event.getContextData().toMap());
		}
		if (message instanceof EventMessage eventMessage) {
			extra.putAll(eventMessage.extra());
		}

		return LogEvent.builder(Severity.fromLog4j(event.getLevel()), formatted)
				.messageTemplate(template == null || template.isEmpty() ? formatted : template)
				.timestamp(Instant.ofEpochMilli(event.getTimeMillis()))
				.loggerName(event.getLoggerName())
				.exception(event.getThrown())
				.extra(extra)
				.context(contexts.currentOrDetected())
				.build();
	}
}
