package org.javai.shuuten.ops.log4j;

import org.apache.logging.log4j.core.config.Configurator;
import org.javai.shuuten.Severity;

import java.util.List;

/**
 * Turns down chatty HTTP and AWS SDK loggers.
 */
public final class QuietLoggers {

	public static final List<String> NOISY_LOGGERS = List.of(
			"software.amazon.awssdk",
			"software.amazon.awssdk.request",
			"org.apache.http",
			"org.apache.http.wire",
			"io.netty",
			"jdk.internal.httpclient"
	);

	private QuietLoggers() {
		// Utility class
	}

	public static void apply(Severity level) {
		for (String name : NOISY_LOGGERS) {
			Configurator.setLevel(name, level.toLog4j());
		}
	}
}
