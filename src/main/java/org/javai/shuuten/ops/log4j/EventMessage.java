package org.javai.shuuten.ops.log4j;

import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.message.ParameterizedMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parameterized Log4j message that also carries structured extras.
 *
 * <p>The unformatted template is kept so that repeated events differing only in their
 * arguments share a dedup fingerprint.
 */
public final class EventMessage implements Message {

	private static final long serialVersionUID = 1L;

	private final ParameterizedMessage delegate;
	private final transient Map<String, Object> extra;

	public EventMessage(String template, Object[] args, Map<String, ?> extra) {
		this.delegate = new ParameterizedMessage(template, args);
		this.extra = extra == null || extra.isEmpty()
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(extra));
	}

	public Map<String, Object> extra() {
		return extra == null ? Map.of() : extra;
	}

	@Override
	public String getFormattedMessage() {
		return delegate.getFormattedMessage();
	}

	@Override
	public String getFormat() {
		return delegate.getFormat();
	}

	@Override
	public Object[] getParameters() {
		return delegate.getParameters();
	}

	@Override
	public Throwable getThrowable() {
		return delegate.getThrowable();
	}

	@Override
	public String toString() {
		return getFormattedMessage();
	}
}
