package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Final answer of the classification pipeline. Also the body Red-Team reads back
 * when it fires at the classify endpoint.
 */
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassificationVerdict {
    private Classification classification;
    private double confidence;
    private String attack_type;
    private String reason;
    private String classifier;
    private boolean blocked;
    private double response_time_ms;
    private int rules_version;
}
