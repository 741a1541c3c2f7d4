package org.javai.shuuten;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SeverityTest {

    @Test
    void ordering_followsNumericValues() {
        assertThat(Severity.CRITICAL.isAtLeast(Severity.ERROR)).isTrue();
        assertThat(Severity.ERROR.isAtLeast(Severity.ERROR)).isTrue();
        assertThat(Severity.WARNING.isAtLeast(Severity.ERROR)).isFalse();
        assertThat(Severity.DEBUG.value()).isEqualTo(10);
        assertThat(Severity.CRITICAL.value()).isEqualTo(50);
    }

    @Test
    void parse_acceptsNamesAliasesAndNumbers() {
        assertThat(Severity.parse("error")).contains(Severity.ERROR);
        assertThat(Severity.parse(" Warning ")).contains(Severity.WARNING);
        assertThat(Severity.parse("warn")).contains(Severity.WARNING);
        assertThat(Severity.parse("FATAL")).contains(Severity.CRITICAL);
        assertThat(Severity.parse("trace")).contains(Severity.DEBUG);
        assertThat(Severity.parse("20")).contains(Severity.INFO);
    }

    @Test
    void parse_rejectsUnknownText() {
        assertThat(Severity.parse("loud")).isEmpty();
        assertThat(Severity.parse("35")).isEmpty();
        assertThat(Severity.parse("")).isEmpty();
        assertThat(Severity.parse(null)).isEmpty();
    }

    @Test
    void log4jMapping_roundTripsEachSeverity() {
        for (Severity severity : Severity.values()) {
            assertThat(Severity.fromLog4j(severity.toLog4j())).isEqualTo(severity);
        }
        assertThat(Severity.fromLog4j(Level.TRACE)).isEqualTo(Severity.DEBUG);
        assertThat(Severity.WARNING.toLog4j()).isEqualTo(Level.WARN);
        assertThat(Severity.CRITICAL.toLog4j()).isEqualTo(Level.FATAL);
    }
}
