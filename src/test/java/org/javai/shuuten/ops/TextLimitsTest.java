package org.javai.shuuten.ops;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TextLimitsTest {

    private static final String ROCKET = "🚀";

    @Test
    void head_shortValue_isUnchanged() {
        assertThat(TextLimits.head("abc", 5)).isEqualTo("abc");
        assertThat(TextLimits.head(null, 5)).isNull();
    }

    @Test
    void head_cutInsideSurrogatePair_dropsWholeCodePoint() {
        String value = "ab" + ROCKET + "cd";

        assertThat(TextLimits.head(value, 3)).isEqualTo("ab");
        assertThat(TextLimits.head(value, 4)).isEqualTo("ab" + ROCKET);
    }

    @Test
    void tail_cutInsideSurrogatePair_dropsWholeCodePoint() {
        String value = "ab" + ROCKET + "cd";

        assertThat(TextLimits.tail(value, 3)).isEqualTo("cd");
        assertThat(TextLimits.tail(value, 4)).isEqualTo(ROCKET + "cd");
    }

    @Test
    void head_neverLeavesLoneSurrogate() {
        String value = ROCKET.repeat(100);

        for (int limit = 1; limit < value.length(); limit++) {
            String cut = TextLimits.head(value, limit);
            assertThat(cut.length()).isLessThanOrEqualTo(limit);
            assertThat(cut.codePoints()).allMatch(cp -> cp == ROCKET.codePointAt(0));
        }
    }
}
