package ai.tablecodec.converter.html;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SpanAttributesTest {

    @Test
    void parsesPlainAndEscapedValues() {
        assertThat(SpanAttributes.parse("3")).isEqualTo(3);
        assertThat(SpanAttributes.parse(" 2 ")).isEqualTo(2);
        assertThat(SpanAttributes.parse("\\\"2\\\"")).isEqualTo(2);
        assertThat(SpanAttributes.parse("'4'")).isEqualTo(4);
    }

    @Test
    void defaultsToOneForMissingOrMalformedValues() {
        assertThat(SpanAttributes.parse(null)).isEqualTo(1);
        assertThat(SpanAttributes.parse("")).isEqualTo(1);
        assertThat(SpanAttributes.parse("two")).isEqualTo(1);
        assertThat(SpanAttributes.parse("0")).isEqualTo(1);
        assertThat(SpanAttributes.parse("-2")).isEqualTo(1);
        assertThat(SpanAttributes.parse("1.5")).isEqualTo(1);
    }

    @Test
    void capsOversizedValues() {
        assertThat(SpanAttributes.parse("5000")).isEqualTo(SpanAttributes.MAX_SPAN);
    }
}
