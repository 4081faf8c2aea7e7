package tech.noetzold.waf_api.service.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.waf_api.model.Classification;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EngineResponseParser")
class EngineResponseParserTest {

    private final EngineResponseParser parser = new EngineResponseParser(new ObjectMapper());

    @Test
    @DisplayName("Should parse a verdict wrapped in prose")
    void shouldParseWrappedVerdict() {
        // Given
        String reply = "Analysis follows.\n{\"classification\": \"malicious\", \"confidence\": 0.88, "
                + "\"attack_type\": \"xss\", \"reason\": \"inline handler\"}\nEnd.";

        // When
        EngineOutcome outcome = parser.parse(reply);

        // Then
        assertThat(outcome).isInstanceOf(EngineOutcome.ParsedVerdict.class);
        EngineOutcome.ParsedVerdict verdict = (EngineOutcome.ParsedVerdict) outcome;
        assertThat(verdict.classification()).isEqualTo(Classification.MALICIOUS);
        assertThat(verdict.confidence()).isEqualTo(0.88);
        assertThat(verdict.attackType()).isEqualTo("xss");
        assertThat(verdict.reason()).isEqualTo("inline handler");
    }

    @Test
    @DisplayName("Should clamp confidence and default missing fields")
    void shouldClampAndDefault() {
        EngineOutcome outcome = parser.parse("{\"classification\": \"SAFE\", \"confidence\": 1.7}");

        EngineOutcome.ParsedVerdict verdict = (EngineOutcome.ParsedVerdict) outcome;
        assertThat(verdict.confidence()).isEqualTo(1.0);
        assertThat(verdict.attackType()).isEqualTo("none");
        assertThat(verdict.reason()).isEmpty();
    }

    @Test
    @DisplayName("Should fail on missing or unknown classification")
    void shouldFailWithoutClassification() {
        assertThat(parser.parse("{\"confidence\": 0.9}")).isInstanceOf(EngineOutcome.ParseFailure.class);
        assertThat(parser.parse("{\"classification\": \"MAYBE\"}")).isInstanceOf(EngineOutcome.ParseFailure.class);
    }

    @Test
    @DisplayName("Should fail when the reply holds no object")
    void shouldFailWithoutObject() {
        EngineOutcome outcome = parser.parse("I cannot help with that.");

        assertThat(outcome).isInstanceOf(EngineOutcome.ParseFailure.class);
        assertThat(((EngineOutcome.ParseFailure) outcome).reason()).startsWith("Failed to parse classifier response");
    }
}
