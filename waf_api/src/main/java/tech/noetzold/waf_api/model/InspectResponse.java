package tech.noetzold.waf_api.model;

import lombok.*;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InspectResponse {
    private String verdict;
    private Classification classification;
    private double confidence;
    private String attack_type;
    private String reason;
    private String classifier;
    private boolean blocked;
    private double response_time_ms;
    private int rules_version;

    public static InspectResponse fromVerdict(ClassificationVerdict v) {
        return InspectResponse.builder()
                .verdict(v.isBlocked() ? "BLOCKED" : "PASS")
                .classification(v.getClassification())
                .confidence(v.getConfidence())
                .attack_type(v.getAttack_type())
                .reason(v.getReason())
                .classifier(v.getClassifier())
                .blocked(v.isBlocked())
                .response_time_ms(v.getResponse_time_ms())
                .rules_version(v.getRules_version())
                .build();
    }
}
