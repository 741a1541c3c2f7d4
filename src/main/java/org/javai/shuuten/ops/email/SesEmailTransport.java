package org.javai.shuuten.ops.email;

import org.javai.shuuten.dispatch.DeliveryException;
import org.javai.shuuten.dispatch.PermanentDeliveryException;
import org.javai.shuuten.dispatch.TransientDeliveryException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.SesClientBuilder;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SesException;

import java.time.Duration;

/**
 * Sends email through Amazon SES (AWS SDK v2).
 *
 * <p>Only loaded reflectively by {@link EmailTransports}. SDK retries are off; the
 * destination's retrier owns the retry budget.
 */
public final class SesEmailTransport implements EmailTransport {

	static final Duration API_CALL_TIMEOUT = Duration.ofSeconds(10);
	private static final String CHARSET = "UTF-8";

	private final SesClient client;

	public SesEmailTransport(String region) {
		SesClientBuilder builder = SesClient.builder()
				.overrideConfiguration(ClientOverrideConfiguration.builder()
						.apiCallTimeout(API_CALL_TIMEOUT)
						.retryPolicy(RetryPolicy.none())
						.build());
		if (region != null && !region.isBlank()) {
			builder.region(Region.of(region));
		}
		this.client = builder.build();
	}

	@Override
	public void send(EmailMessage message) throws DeliveryException {
		SendEmailRequest request = SendEmailRequest.builder()
				.source(message.from())
				.destination(Destination.builder().toAddresses(message.to()).build())
				.replyToAddresses(message.replyTo())
				.message(Message.builder()
						.subject(content(message.subject()))
						.body(Body.builder()
								.text(content(message.textBody()))
								.html(content(message.htmlBody()))
								.build())
						.build())
				.build();
		try {
			client.sendEmail(request);
		} catch (SesException e) {
			throw classify(e);
		} catch (SdkClientException e) {
			throw new TransientDeliveryException("SES client error: " + e.getMessage(), e);
		} catch (SdkException e) {
			throw new PermanentDeliveryException("SES error: " + e.getMessage(), e);
		}
	}

	private static DeliveryException classify(SesException e) {
		String code = e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
		String detail = "SES rejected the message (" + e.statusCode() + (code != null ? " " + code : "") + "): "
				+ (e.awsErrorDetails() == null ? e.getMessage() : e.awsErrorDetails().errorMessage());
		if (e.statusCode() == 429 || e.statusCode() >= 500 || e.isThrottlingException()
				|| "Throttling".equals(code)) {
			return new TransientDeliveryException(detail, e);
		}
		return new PermanentDeliveryException(detail, e);
	}

	private static Content content(String data) {
		return Content.builder().data(data).charset(CHARSET).build();
	}
}
