package org.stepreduce.step;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class StepStringsTest {

    @Test
    void decode_decodesX2Unicode() {
        assertThat(StepStrings.decode("\\X2\\4E2D6587\\X0\\")).isEqualTo("中文");
    }

    @Test
    void decode_decodesX4AndSingleByteEscapes() {
        assertThat(StepStrings.decode("\\X4\\0001F600\\X0\\")).isEqualTo("😀");
        assertThat(StepStrings.decode("caf\\X\\E9")).isEqualTo("café");
    }

    @Test
    void decode_collapsesDoubledQuotes() {
        assertThat(StepStrings.decode("O''Reilly")).isEqualTo("O'Reilly");
    }

    @Test
    void decode_reinterpretsRawUtf8Bytes() {
        String raw = new String("零件A".getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);

        assertThat(StepStrings.decode(raw)).isEqualTo("零件A");
    }

    @Test
    void decode_keepsMalformedEscapesLiterally() {
        assertThat(StepStrings.decode("\\X2\\4E2\\X0\\")).isEqualTo("\\X2\\4E2\\X0\\");
    }
}
