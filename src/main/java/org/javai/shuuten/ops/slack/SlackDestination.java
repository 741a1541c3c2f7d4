package org.javai.shuuten.ops.slack;

import org.javai.shuuten.ConfigurationException;
import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.ShuutenConfig;
import org.javai.shuuten.SlackFormat;
import org.javai.shuuten.dispatch.Destination;
import org.javai.shuuten.dispatch.PermanentDeliveryException;
import org.javai.shuuten.dispatch.TransientDeliveryException;
import org.javai.shuuten.retry.DeliveryRetrier;
import org.javai.shuuten.retry.RetryPolicy;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Posts events to a Slack incoming webhook.
 *
 * <p>Without a webhook URL the destination is inert: it reports itself disabled and the
 * interceptor never calls {@link #send}. A malformed URL is treated the same way, with the
 * parse error as the disabled reason.
 *
 * <p>Rate limiting (429), server errors and network failures are retried with backoff,
 * honouring {@code Retry-After}. Any other 4xx is permanent.
 */
public class SlackDestination implements Destination {

	public static final String NAME = "slack";

	static final Duration TIMEOUT = Duration.ofSeconds(5);
	static final Duration MAX_TIMEOUT = Duration.ofSeconds(10);
	private static final int ERROR_BODY_LIMIT = 300;

	private final URI webhook;
	private final String disabledReason;
	private final SlackFormat format;
	private final String username;
	private final Duration timeout;
	private final HttpClient httpClient;
	private final DeliveryRetrier retrier;

	/**
	 * Creates a destination from the resolved configuration. Never throws; an absent or
	 * malformed webhook URL yields a disabled destination.
	 */
	public static SlackDestination fromConfig(ShuutenConfig config) {
		return new SlackDestination(config.slackWebhookUrl(), config.slackFormat());
	}

	public SlackDestination(String webhookUrl, SlackFormat format) {
		this(webhookUrl, format, null, TIMEOUT);
	}

	/**
	 * @param username optional display-name override sent with every message
	 * @param timeout per-request timeout, capped at ten seconds
	 */
	public SlackDestination(String webhookUrl, SlackFormat format, String username, Duration timeout) {
		this(webhookUrl, format, username, timeout,
				HttpClient.newBuilder().connectTimeout(cap(timeout)).build(),
				defaultRetrier());
	}

	/**
	 * Creates a SlackDestination with a custom HttpClient and retrier. Useful for testing.
	 */
	SlackDestination(String webhookUrl, SlackFormat format, String username, Duration timeout,
					 HttpClient httpClient, DeliveryRetrier retrier) {
		this.format = Objects.requireNonNull(format, "format must not be null");
		this.username = username;
		this.timeout = cap(timeout);
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
		this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");

		URI parsed = null;
		String reason = null;
		if (webhookUrl == null || webhookUrl.isBlank()) {
			reason = "no Slack webhook URL configured";
		} else {
			try {
				parsed = parseWebhook(webhookUrl.trim());
			} catch (ConfigurationException e) {
				reason = e.getMessage();
			}
		}
		this.webhook = parsed;
		this.disabledReason = reason;
	}

	static DeliveryRetrier defaultRetrier() {
		return DeliveryRetrier.builder()
				.policy(RetryPolicy.exponentialBackoff(NAME, 3, Duration.ofMillis(500), Duration.ofSeconds(4)))
				.budget(Duration.ofSeconds(20))
				.build();
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isEnabled() {
		return webhook != null;
	}

	@Override
	public String disabledReason() {
		return disabledReason;
	}

	@Override
	public DestinationResult send(LogEvent event) {
		if (!isEnabled()) {
			return DestinationResult.disabled(NAME, disabledReason);
		}
		String body = SlackPayloads.render(event, format, username);
		return retrier.deliver(NAME, () -> post(body));
	}

	private void post(String jsonBody) throws TransientDeliveryException, PermanentDeliveryException {
		HttpRequest request = HttpRequest.newBuilder()
				.uri(webhook)
				.header("Content-Type", "application/json; charset=utf-8")
				.timeout(timeout)
				.POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
				.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		} catch (IOException e) {
			throw new TransientDeliveryException("Slack webhook request failed: " + e, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PermanentDeliveryException("Slack webhook request interrupted", e);
		}

		int status = response.statusCode();
		if (status >= 200 && status < 300) {
			return;
		}
		String detail = "Slack webhook returned status " + status + ": " + SlackPayloads.truncate(
				response.body() == null ? "" : response.body(), ERROR_BODY_LIMIT);
		if (status == 429 || status >= 500) {
			throw new TransientDeliveryException(detail, null, retryAfter(response));
		}
		throw new PermanentDeliveryException(detail);
	}

	private static Duration retryAfter(HttpResponse<?> response) {
		return response.headers().firstValue("Retry-After")
				.map(String::trim)
				.filter(v -> !v.isEmpty() && v.length() <= 9 && v.chars().allMatch(Character::isDigit))
				.map(v -> Duration.ofSeconds(Long.parseLong(v)))
				.orElse(null);
	}

	static URI parseWebhook(String url) {
		URI uri;
		try {
			uri = URI.create(url);
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException("invalid Slack webhook URL: " + e.getMessage(), e);
		}
		String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
		if (!scheme.equals("https") && !scheme.equals("http")) {
			throw new ConfigurationException("invalid Slack webhook URL: scheme must be http or https");
		}
		if (uri.getHost() == null) {
			throw new ConfigurationException("invalid Slack webhook URL: missing host");
		}
		return uri;
	}

	private static Duration cap(Duration timeout) {
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			return TIMEOUT;
		}
		return timeout.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : timeout;
	}
}
