package org.javai.shuuten.ops.email;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.ShuutenConfig;
import org.javai.shuuten.dispatch.DeliveryException;
import org.javai.shuuten.dispatch.Destination;
import org.javai.shuuten.retry.DeliveryRetrier;
import org.javai.shuuten.retry.RetryPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Emails events to a fixed recipient list.
 *
 * <p>The transport is created on first send, so a process that never dispatches never
 * touches the mail SDK. Without a sender or recipients the destination is disabled.
 */
public class EmailDestination implements Destination {

	public static final String NAME = "email";

	private final String from;
	private final List<String> to;
	private final List<String> replyTo;
	private final TransportFactory transportFactory;
	private final DeliveryRetrier retrier;
	private volatile EmailTransport transport;

	/**
	 * Creates an SES-backed destination from the resolved configuration.
	 */
	public static EmailDestination fromConfig(ShuutenConfig config) {
		return new EmailDestination(config.sesFrom(), config.sesTo(), config.sesReplyTo(),
				() -> EmailTransports.ses(config.sesRegion()), defaultRetrier());
	}

	public EmailDestination(String from, List<String> to, List<String> replyTo, EmailTransport transport) {
		this(from, to, replyTo, () -> transport, defaultRetrier());
	}

	EmailDestination(String from, List<String> to, List<String> replyTo,
					 TransportFactory transportFactory, DeliveryRetrier retrier) {
		this.from = from == null || from.isBlank() ? null : from.trim();
		this.to = to == null ? List.of() : List.copyOf(to);
		this.replyTo = replyTo == null ? List.of() : List.copyOf(replyTo);
		this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory must not be null");
		this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
	}

	static DeliveryRetrier defaultRetrier() {
		return DeliveryRetrier.builder()
				.policy(RetryPolicy.exponentialBackoff(NAME, 3, Duration.ofMillis(500), Duration.ofSeconds(4)))
				.budget(Duration.ofSeconds(30))
				.build();
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isEnabled() {
		return from != null && !to.isEmpty();
	}

	@Override
	public String disabledReason() {
		if (from == null) {
			return "no sender address configured";
		}
		return to.isEmpty() ? "no recipient addresses configured" : null;
	}

	@Override
	public DestinationResult send(LogEvent event) {
		if (!isEnabled()) {
			return DestinationResult.disabled(NAME, disabledReason());
		}
		EmailMessage message = new EmailMessage(from, to, replyTo,
				EmailRenderer.subject(event), EmailRenderer.text(event), EmailRenderer.html(event));
		return retrier.deliver(NAME, () -> transport().send(message));
	}

	private EmailTransport transport() throws DeliveryException {
		EmailTransport current = transport;
		if (current == null) {
			synchronized (this) {
				current = transport;
				if (current == null) {
					current = Objects.requireNonNull(transportFactory.create(), "transport factory returned null");
					transport = current;
				}
			}
		}
		return current;
	}

	/**
	 * Creates the transport on first use.
	 */
	@FunctionalInterface
	interface TransportFactory {
		EmailTransport create() throws DeliveryException;
	}
}
