package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Unvalidated technique as proposed by a generator or the seed catalog. Category and severity
 * stay raw strings until the store coerces them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TechniqueCandidate(
        String technique_name,
        String category,
        String raw_payload,
        String severity,
        String source
) {

    public boolean isComplete() {
        return technique_name != null && !technique_name.isBlank()
                && raw_payload != null && !raw_payload.isBlank();
    }
}
