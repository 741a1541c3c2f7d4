package org.javai.shuuten.ops.email;

import org.javai.shuuten.dispatch.PermanentDeliveryException;

import java.lang.reflect.InvocationTargetException;

/**
 * Loads the SES transport without a compile-time link to the AWS SDK.
 *
 * <p>The SES client is an optional dependency. When it is missing from the classpath the
 * load fails with a {@link PermanentDeliveryException}, which the email destination reports
 * as a failed delivery.
 */
public final class EmailTransports {

	static final String SES_CLIENT_CLASS = "software.amazon.awssdk.services.ses.SesClient";
	static final String SES_TRANSPORT_CLASS = "org.javai.shuuten.ops.email.SesEmailTransport";

	private EmailTransports() {
		// Utility class
	}

	public static boolean sesAvailable() {
		return isPresent(SES_CLIENT_CLASS);
	}

	/**
	 * @param region SES region, or null for the SDK's default region chain
	 */
	public static EmailTransport ses(String region) throws PermanentDeliveryException {
		if (!sesAvailable()) {
			throw new PermanentDeliveryException(
					"SES email requires software.amazon.awssdk:ses on the classpath");
		}
		try {
			Class<?> type = Class.forName(SES_TRANSPORT_CLASS);
			return (EmailTransport) type.getConstructor(String.class).newInstance(region);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw new PermanentDeliveryException("Unable to create SES client: " + cause, cause);
		} catch (ReflectiveOperationException | LinkageError e) {
			throw new PermanentDeliveryException("Unable to load SES transport: " + e, e);
		}
	}

	private static boolean isPresent(String className) {
		try {
			Class.forName(className, false, EmailTransports.class.getClassLoader());
			return true;
		} catch (ClassNotFoundException | LinkageError e) {
			return false;
		}
	}
}
