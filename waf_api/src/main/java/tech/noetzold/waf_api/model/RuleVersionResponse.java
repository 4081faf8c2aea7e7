package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleVersionResponse {
    private int version;
    private Instant updated_at;
    private RuleAuthor updated_by;
    private String fast_prompt;
    private String deep_prompt;

    /** History row, without the prompt texts. */
    public static RuleVersionResponse summaryOf(RuleVersion r) {
        return RuleVersionResponse.builder()
                .version(r.getVersion())
                .updated_at(r.getUpdatedAt())
                .updated_by(r.getUpdatedBy())
                .build();
    }

    public static RuleVersionResponse fromEntity(RuleVersion r) {
        return RuleVersionResponse.builder()
                .version(r.getVersion())
                .updated_at(r.getUpdatedAt())
                .updated_by(r.getUpdatedBy())
                .fast_prompt(r.getFastPrompt())
                .deep_prompt(r.getDeepPrompt())
                .build();
    }
}
