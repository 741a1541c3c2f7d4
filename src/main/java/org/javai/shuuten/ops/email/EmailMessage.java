package org.javai.shuuten.ops.email;

import java.util.List;
import java.util.Objects;

/**
 * A rendered notification email, ready for a transport.
 */
public record EmailMessage(
		String from,
		List<String> to,
		List<String> replyTo,
		String subject,
		String textBody,
		String htmlBody
) {

	public EmailMessage {
		Objects.requireNonNull(from, "from must not be null");
		Objects.requireNonNull(subject, "subject must not be null");
		Objects.requireNonNull(textBody, "textBody must not be null");
		Objects.requireNonNull(htmlBody, "htmlBody must not be null");
		to = List.copyOf(to);
		replyTo = replyTo == null ? List.of() : List.copyOf(replyTo);
		if (to.isEmpty()) {
			throw new IllegalArgumentException("at least one recipient is required");
		}
	}
}
