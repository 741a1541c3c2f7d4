package org.javai.shuuten.context;

import org.javai.shuuten.Environment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ContextDetectorTest {

    private static ContextDetector detector(Map<String, String> env) {
        return ContextDetector.builder()
                .app("billing")
                .env("prod")
                .environment(Environment.of(env))
                .build();
    }

    @Test
    void detect_lambdaContext_extractsInvocationMetadata() {
        RuntimeContext context = detector(Map.of()).detect(new FakeLambdaContext());

        assertThat(context.source()).isEqualTo(Source.LAMBDA);
        assertThat(context.invocationId()).isEqualTo(FakeLambdaContext.REQUEST_ID);
        assertThat(context.app()).isEqualTo("billing");
        assertThat(context.env()).isEqualTo("prod");
        assertThat(context.caller())
                .containsEntry(RuntimeContext.FUNCTION_NAME, FakeLambdaContext.FUNCTION_NAME)
                .containsEntry(RuntimeContext.REQUEST_ID, FakeLambdaContext.REQUEST_ID)
                .containsEntry(RuntimeContext.REGION, "eu-west-1")
                .containsEntry(RuntimeContext.ACCOUNT_ID, "123456789012")
                .containsEntry(RuntimeContext.LOG_GROUP, FakeLambdaContext.LOG_GROUP);
        assertThat(context.callerValue(RuntimeContext.LOG_URL)).hasValueSatisfying(url -> assertThat(url)
                .startsWith("https://console.aws.amazon.com/cloudwatch/home?region=eu-west-1")
                .contains("%2Faws%2Flambda%2Fnightly-billing"));
    }

    @Test
    void detect_lambdaMapEnvelope_isRecognised() {
        RuntimeContext context = detector(Map.of("AWS_REGION", "us-east-2"))
                .detect(Map.of("aws_request_id", "req-1", "function_name", "sync-job"));

        assertThat(context.source()).isEqualTo(Source.LAMBDA);
        assertThat(context.invocationId()).isEqualTo("req-1");
        assertThat(context.caller()).containsEntry(RuntimeContext.REGION, "us-east-2");
    }

    @Test
    void detect_lambdaEnvironmentOnly_isRecognised() {
        RuntimeContext context = detector(Map.of("AWS_LAMBDA_FUNCTION_NAME", "sync-job")).detect(null);

        assertThat(context.source()).isEqualTo(Source.LAMBDA);
        assertThat(context.caller()).containsEntry(RuntimeContext.FUNCTION_NAME, "sync-job");
        assertThat(context.invocationId()).isNotBlank();
    }

    @Test
    void detect_ecsEnvironment_isRecognised() {
        RuntimeContext context = detector(Map.of(
                "ECS_CONTAINER_METADATA_URI_V4", "http://169.254.170.2/v4/abc",
                "ECS_TASK_ARN", "arn:aws:ecs:us-west-2:210987654321:task/reports/9f1e2d",
                "ECS_CLUSTER", "reports"
        )).detect(null);

        assertThat(context.source()).isEqualTo(Source.ECS);
        assertThat(context.invocationId()).isEqualTo("9f1e2d");
        assertThat(context.caller())
                .containsEntry(RuntimeContext.CLUSTER, "reports")
                .containsEntry(RuntimeContext.REGION, "us-west-2")
                .containsEntry(RuntimeContext.ACCOUNT_ID, "210987654321");
    }

    @Test
    void detect_nothingRecognised_isGenericWithGeneratedId() {
        RuntimeContext first = detector(Map.of()).detect("not an envelope");
        RuntimeContext second = detector(Map.of()).detect(null);

        assertThat(first.source()).isEqualTo(Source.GENERIC);
        assertThat(first.caller()).isEmpty();
        assertThat(first.invocationId()).isNotEqualTo(second.invocationId());
    }

    @Test
    void detect_forcedGeneric_skipsProbes() {
        RuntimeContext context = detector(Map.of()).detect(new FakeLambdaContext(), Source.GENERIC);

        assertThat(context.source()).isEqualTo(Source.GENERIC);
        assertThat(context.caller()).doesNotContainKey(RuntimeContext.FUNCTION_NAME);
    }

    @Test
    void detect_throwingProbe_isSkipped() {
        ContextProbe broken = new ContextProbe() {
            @Override
            public Source source() {
                return Source.ECS;
            }

            @Override
            public Optional<Detection> probe(Object envelope, Environment environment) throws ContextDetectionException {
                throw new ContextDetectionException("metadata unreadable", null);
            }
        };
        ContextDetector detector = ContextDetector.builder()
                .environment(Environment.empty())
                .probes(List.of(broken, new LambdaProbe()))
                .build();

        assertThat(detector.detect(new FakeLambdaContext()).source()).isEqualTo(Source.LAMBDA);
    }

    @Test
    void detect_accountNameAndSourceCode_comeFromEnvironment() {
        RuntimeContext context = detector(Map.of(
                "AWS_ACCOUNT_NAME", "payments-prod",
                "SOURCE_CODE", "https://git.example.com/billing"
        )).detect(new FakeLambdaContext());

        assertThat(context.caller())
                .containsEntry(RuntimeContext.ACCOUNT_NAME, "payments-prod")
                .containsEntry(RuntimeContext.SOURCE_CODE, "https://git.example.com/billing");
    }
}
