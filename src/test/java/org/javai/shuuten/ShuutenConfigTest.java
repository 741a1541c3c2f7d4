package org.javai.shuuten;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ShuutenConfigTest {

    private static ShuutenConfig.Builder isolated(Map<String, String> env) {
        return ShuutenConfig.builder()
                .environment(Environment.of(env))
                .systemProperties(new Properties());
    }

    @Test
    void build_withNothingSet_usesDefaults() {
        ShuutenConfig config = isolated(Map.of()).build();

        assertThat(config.app()).isEqualTo("app");
        assertThat(config.env()).isEqualTo("dev");
        assertThat(config.minLevel()).isEqualTo(Severity.ERROR);
        assertThat(config.emitLocalLog()).isTrue();
        assertThat(config.dedupWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.quiet()).isEmpty();
        assertThat(config.slackFormat()).isEqualTo(SlackFormat.BLOCKS);
        assertThat(config.slackConfigured()).isFalse();
        assertThat(config.emailConfigured()).isFalse();
    }

    @Test
    void build_readsEnvironmentVariables() {
        ShuutenConfig config = isolated(Map.of(
                "SHUUTEN_APP", "billing",
                "SHUUTEN_ENV", "prod",
                "SHUUTEN_MIN_LEVEL", "warning",
                "SHUUTEN_EMIT_LOCAL_LOG", "false",
                "SHUUTEN_DEDUPE_WINDOW_S", "2.5",
                "SHUUTEN_QUIET_LEVEL", "40",
                "SHUUTEN_SLACK_WEBHOOK_URL", "https://hooks.slack.test/T/B/X",
                "SHUUTEN_SLACK_FORMAT", "plain",
                "SHUUTEN_SES_FROM", "alerts@example.com",
                "SHUUTEN_SES_TO", "ops@example.com, , oncall@example.com"
        )).build();

        assertThat(config.app()).isEqualTo("billing");
        assertThat(config.env()).isEqualTo("prod");
        assertThat(config.minLevel()).isEqualTo(Severity.WARNING);
        assertThat(config.emitLocalLog()).isFalse();
        assertThat(config.dedupWindow()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.quiet()).contains(Severity.ERROR);
        assertThat(config.slackFormat()).isEqualTo(SlackFormat.PLAIN);
        assertThat(config.slackConfigured()).isTrue();
        assertThat(config.sesTo()).containsExactly("ops@example.com", "oncall@example.com");
        assertThat(config.emailConfigured()).isTrue();
    }

    @Test
    void build_systemPropertyOverridesEnvironment_andExplicitOverridesBoth() {
        Properties props = new Properties();
        props.setProperty("shuuten.env", "staging");
        props.setProperty("shuuten.app", "from-props");

        ShuutenConfig config = ShuutenConfig.builder()
                .environment(Environment.of(Map.of("SHUUTEN_ENV", "prod", "SHUUTEN_APP", "from-env")))
                .systemProperties(props)
                .app("explicit")
                .build();

        assertThat(config.env()).isEqualTo("staging");
        assertThat(config.app()).isEqualTo("explicit");
    }

    @Test
    void build_invalidValuesFallBackToDefaults() {
        ShuutenConfig config = isolated(Map.of(
                "SHUUTEN_MIN_LEVEL", "loud",
                "SHUUTEN_DEDUPE_WINDOW_S", "soon",
                "SHUUTEN_EMIT_LOCAL_LOG", "maybe",
                "SHUUTEN_SLACK_FORMAT", "fancy"
        )).build();

        assertThat(config.minLevel()).isEqualTo(Severity.ERROR);
        assertThat(config.dedupWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.emitLocalLog()).isTrue();
        assertThat(config.slackFormat()).isEqualTo(SlackFormat.BLOCKS);
    }

    @Test
    void build_negativeWindowFallsBackToDefault_zeroDisables() {
        assertThat(isolated(Map.of("SHUUTEN_DEDUPE_WINDOW_S", "-1")).build().dedupWindow())
                .isEqualTo(Duration.ofSeconds(30));
        assertThat(isolated(Map.of("SHUUTEN_DEDUPE_WINDOW_S", "0")).build().dedupWindow())
                .isEqualTo(Duration.ZERO);
    }

    @Test
    void emailConfigured_requiresSenderAndRecipients() {
        assertThat(isolated(Map.of("SHUUTEN_SES_FROM", "alerts@example.com")).build().emailConfigured()).isFalse();
        assertThat(isolated(Map.of("SHUUTEN_SES_TO", "ops@example.com")).build().emailConfigured()).isFalse();
    }

    @Test
    void splitAddresses_trimsAndDropsBlanks() {
        assertThat(ShuutenConfig.splitAddresses(" a@x.com ,b@x.com,, ")).isEqualTo(List.of("a@x.com", "b@x.com"));
        assertThat(ShuutenConfig.splitAddresses(null)).isEmpty();
    }
}
