package org.javai.shuuten.ops.email;

import org.javai.shuuten.dispatch.DeliveryException;

/**
 * Hands a rendered message to a mail service.
 */
@FunctionalInterface
public interface EmailTransport {

	/**
	 * @throws DeliveryException transient for throttling and network trouble, permanent otherwise
	 */
	void send(EmailMessage message) throws DeliveryException;
}
