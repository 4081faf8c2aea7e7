package tech.noetzold.waf_api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonSpans")
class JsonSpansTest {

    @Test
    @DisplayName("Should extract the first object from surrounding prose")
    void shouldExtractObject() {
        String reply = "Sure! Here is my verdict:\n```json\n{\"classification\": \"SAFE\", \"nested\": {\"a\": 1}}\n```\nThanks.";

        assertThat(JsonSpans.firstObject(reply))
                .contains("{\"classification\": \"SAFE\", \"nested\": {\"a\": 1}}");
    }

    @Test
    @DisplayName("Should ignore braces inside strings")
    void shouldRespectStrings() {
        String reply = "{\"reason\": \"payload has } and \\\" inside\", \"x\": 2} trailing }";

        assertThat(JsonSpans.firstObject(reply))
                .contains("{\"reason\": \"payload has } and \\\" inside\", \"x\": 2}");
    }

    @Test
    @DisplayName("Should extract an array and report absence")
    void shouldExtractArray() {
        assertThat(JsonSpans.firstArray("list: [{\"a\": [1, 2]}, {\"b\": 3}] done"))
                .contains("[{\"a\": [1, 2]}, {\"b\": 3}]");
        assertThat(JsonSpans.firstArray("no json here")).isEmpty();
        assertThat(JsonSpans.firstObject("{ never closed")).isEmpty();
        assertThat(JsonSpans.firstObject(null)).isEmpty();
    }
}
