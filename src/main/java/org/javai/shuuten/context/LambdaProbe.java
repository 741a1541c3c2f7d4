package org.javai.shuuten.context;

import com.amazonaws.services.lambda.runtime.Context;
import org.javai.shuuten.Environment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises AWS Lambda invocations.
 *
 * <p>Matches, in order: an {@code aws-lambda-java-core} {@link Context}; a map carrying a
 * request id or function name; or the {@code AWS_LAMBDA_FUNCTION_NAME} variable the Lambda
 * runtime always sets.
 */
public final class LambdaProbe implements ContextProbe {

    @Override
    public Source source() {
        return Source.LAMBDA;
    }

    @Override
    public Optional<Detection> probe(Object envelope, Environment environment) throws ContextDetectionException {
        if (envelope instanceof Context lambdaContext) {
            return Optional.of(fromContext(lambdaContext, environment));
        }
        if (envelope instanceof Map<?, ?> map) {
            String requestId = ContextProbe.firstString(map, "aws_request_id", "awsRequestId", "request_id", "requestId");
            String functionName = ContextProbe.firstString(map, "function_name", "functionName");
            if (requestId != null || functionName != null) {
                return Optional.of(build(
                        requestId,
                        functionName,
                        ContextProbe.firstString(map, "invoked_function_arn", "invokedFunctionArn", "function_arn"),
                        ContextProbe.firstString(map, "log_group_name", "logGroupName"),
                        ContextProbe.firstString(map, "log_stream_name", "logStreamName"),
                        environment));
            }
        }
        if (environment.getNonBlank("AWS_LAMBDA_FUNCTION_NAME") != null) {
            return Optional.of(build(null, null, null, null, null, environment));
        }
        return Optional.empty();
    }

    private Detection fromContext(Context lambdaContext, Environment environment) throws ContextDetectionException {
        try {
            return build(
                    lambdaContext.getAwsRequestId(),
                    lambdaContext.getFunctionName(),
                    lambdaContext.getInvokedFunctionArn(),
                    lambdaContext.getLogGroupName(),
                    lambdaContext.getLogStreamName(),
                    environment);
        } catch (RuntimeException e) {
            throw new ContextDetectionException("Lambda context could not be read", e);
        }
    }

    private Detection build(String requestId, String functionName, String functionArn,
                            String logGroup, String logStream, Environment environment) {
        Map<String, String> caller = new LinkedHashMap<>();
        put(caller, RuntimeContext.FUNCTION_NAME, orEnv(functionName, environment, "AWS_LAMBDA_FUNCTION_NAME"));
        put(caller, RuntimeContext.FUNCTION_ARN, functionArn);
        put(caller, RuntimeContext.REQUEST_ID, requestId);
        put(caller, RuntimeContext.LOG_GROUP, orEnv(logGroup, environment, "AWS_LAMBDA_LOG_GROUP_NAME"));
        put(caller, RuntimeContext.LOG_STREAM, orEnv(logStream, environment, "AWS_LAMBDA_LOG_STREAM_NAME"));
        put(caller, RuntimeContext.ACCOUNT_ID, ContextProbe.arnSegment(functionArn, 4));
        String region = ContextProbe.arnSegment(functionArn, 3);
        put(caller, RuntimeContext.REGION, region);
        return new Detection(requestId, caller);
    }

    private static String orEnv(String value, Environment environment, String name) {
        return value != null && !value.isBlank() ? value : environment.getNonBlank(name);
    }

    private static void put(Map<String, String> caller, String key, String value) {
        if (value != null && !value.isBlank()) {
            caller.put(key, value);
        }
    }
}
