package tech.noetzold.waf_api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PercentDecoding")
class PercentDecodingTest {

    @Test
    @DisplayName("Should leave malformed escapes and plus signs untouched")
    void shouldBeLenient() {
        assertThat(PercentDecoding.unquote("a+b%zz%4")).isEqualTo("a+b%zz%4");
        assertThat(PercentDecoding.unquote("%3Cscript%3E")).isEqualTo("<script>");
    }

    @Test
    @DisplayName("Should decode multi-byte UTF-8 sequences")
    void shouldDecodeUtf8() {
        assertThat(PercentDecoding.unquote("caf%C3%A9")).isEqualTo("café");
    }

    @Test
    @DisplayName("Should stop after the requested number of layers")
    void shouldHonourLayerCount() {
        assertThat(PercentDecoding.unquote("%25252e", 1)).isEqualTo("%252e");
        assertThat(PercentDecoding.unquote("%25252e", 2)).isEqualTo("%2e");
    }

    @Test
    @DisplayName("Should fold encoding, case and whitespace into one canonical form")
    void shouldNormalise() {
        // Given
        String plain = "' OR 1=1 --";
        String disguised = "%27%20or%20%201%3D1\t--  ";

        // When / Then
        assertThat(PercentDecoding.normalizePayload(disguised))
                .isEqualTo(PercentDecoding.normalizePayload(plain))
                .isEqualTo("' or 1=1 --");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "%252e%252e%252fetc%252fpasswd",
            "%2525252e%2525252e",
            "  SELECT\n\n*  FROM users  ",
            "<ScRiPt>alert(1)</sCrIpT>",
            "%E2%80%A8%u0041%0A%0D",
            "100%25 %%41"
    })
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String payload) {
        String once = PercentDecoding.normalizePayload(payload);
        assertThat(PercentDecoding.normalizePayload(once)).isEqualTo(once);
    }
}
