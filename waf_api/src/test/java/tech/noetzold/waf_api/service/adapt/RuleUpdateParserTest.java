package tech.noetzold.waf_api.service.adapt;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.waf_api.client.EngineException;
import tech.noetzold.waf_api.model.RuleAuthor;
import tech.noetzold.waf_api.model.RuleVersion;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleUpdateParser")
class RuleUpdateParserTest {

    private final RuleUpdateParser parser = new RuleUpdateParser(new ObjectMapper());

    private final RuleVersion previous = RuleVersion.builder()
            .version(2).fastPrompt("old fast").deepPrompt("old deep")
            .updatedAt(Instant.EPOCH).updatedBy(RuleAuthor.SYSTEM).build();

    @Test
    @DisplayName("Should carry a blank prompt forward from the previous version")
    void shouldCarryForward() {
        // When
        RuleUpdate update = parser.parse("```json\n{\"analysis\": \"double encoding slipped through\", "
                + "\"fast_prompt\": \"new fast\", \"deep_prompt\": \"\", \"new_patterns\": [\"%25xx layers\", 7, null]}\n```", previous);

        // Then
        assertThat(update.fastPrompt()).isEqualTo("new fast");
        assertThat(update.deepPrompt()).isEqualTo("old deep");
        assertThat(update.analysis()).isEqualTo("double encoding slipped through");
        assertThat(update.newPatterns()).containsExactly("%25xx layers", "7");
    }

    @Test
    @DisplayName("Should reject a reply with no usable prompt")
    void shouldRejectEmptyUpdate() {
        assertThatThrownBy(() -> parser.parse("{\"analysis\": \"nothing to add\"}", previous))
                .isInstanceOf(EngineException.class)
                .extracting(e -> ((EngineException) e).getErrorType())
                .isEqualTo(EngineException.ErrorType.PARSE_ERROR);
        assertThatThrownBy(() -> parser.parse("no json at all", previous))
                .isInstanceOf(EngineException.class);
    }
}
