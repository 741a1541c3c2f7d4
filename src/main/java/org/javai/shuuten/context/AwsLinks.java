package org.javai.shuuten.context;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Deep links into the AWS console.
 */
public final class AwsLinks {

    private static final String AWS_CONSOLE = "https://console.aws.amazon.com";

    private AwsLinks() {
        // Utility class
    }

    public static String lambdaFunction(String region, String functionName) {
        return AWS_CONSOLE + "/lambda/home?region=" + encode(region) + "#/functions/" + encode(functionName);
    }

    /**
     * Link to a CloudWatch log group, or to one stream within it when {@code logStream} is given.
     * Group and stream names usually contain '/' and '[]' and are fully encoded.
     */
    public static String cloudWatchLogStream(String region, String logGroup, String logStream) {
        String link = AWS_CONSOLE + "/cloudwatch/home?region=" + encode(region)
                + "#logEventViewer:group=" + encode(logGroup);
        if (logStream != null && !logStream.isBlank()) {
            link += ";stream=" + encode(logStream);
        }
        return link;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
