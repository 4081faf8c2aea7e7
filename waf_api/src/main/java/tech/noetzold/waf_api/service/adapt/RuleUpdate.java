package tech.noetzold.waf_api.service.adapt;

import java.util.List;

/**
 * Replacement rule pair proposed by the generator. A blank prompt has already been replaced by
 * the previous text when this is built by {@link RuleUpdateParser}.
 */
public record RuleUpdate(
        String analysis,
        String fastPrompt,
        String deepPrompt,
        List<String> newPatterns
) {

    public RuleUpdate {
        analysis = analysis == null ? "" : analysis.trim();
        newPatterns = newPatterns == null ? List.of() : List.copyOf(newPatterns);
    }
}
