package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Technique generation strategies. Declaration order is the rotation order used by Scout.
 */
public enum Strategy {
    MUTATE_BYPASSES("mutate_bypasses",
            "These techniques recently BYPASSED the WAF and are your most valuable starting points.\n"
                    + "Mutate them: change encoding layers, swap syntax variants, insert comments/whitespace,\n"
                    + "split the payload across parameters, or wrap it in a different HTTP context.\n"
                    + "The goal is to create variations that would ALSO bypass the same detection rules."),
    CROSS_CATEGORY("cross_category",
            "Generate HYBRID attacks that combine multiple categories in a single request.\n"
                    + "Examples: SQLi inside a JSON field that also carries XSS; SSRF via an XXE entity;\n"
                    + "command injection chained with path traversal; auth bypass via header injection."),
    ENCODING_CHAINS("encoding_chains",
            "Focus on EVASION through encoding and obfuscation:\n"
                    + "- Double/triple URL encoding (%2527 = %27 = ')\n"
                    + "- Unicode normalisation tricks (fullwidth characters, homoglyphs, overlong UTF-8)\n"
                    + "- Mixed encoding (URL + HTML entities + Unicode in one payload)\n"
                    + "- Null byte injection (%00) to truncate strings\n"
                    + "- Case randomisation and comment insertion (SEL/**/ECT, <ScRiPt>)\n"
                    + "- Chunked transfer encoding to split payloads across chunks"),
    CONTEXT_SHIFT("context_shift",
            "Take KNOWN attack patterns and deliver them in UNUSUAL HTTP contexts:\n"
                    + "- multipart/form-data file upload fields\n"
                    + "- nested JSON objects or arrays\n"
                    + "- HTTP headers (X-Forwarded-For, Referer, User-Agent, Cookie)\n"
                    + "- GraphQL query variables\n"
                    + "- WebSocket upgrade requests\n"
                    + "- XML attributes or CDATA sections"),
    EMERGING_TECHNIQUES("emerging_techniques",
            "Generate attacks using MODERN and EMERGING technique families:\n"
                    + "- Server-side template injection: {{7*7}}, ${7*7}, <%= 7*7 %>\n"
                    + "- Prototype pollution: __proto__, constructor.prototype in JSON\n"
                    + "- GraphQL injection: introspection, batched mutations, alias abuse\n"
                    + "- HTTP request smuggling: CL.TE / TE.CL desync\n"
                    + "- Cache poisoning through unkeyed headers\n"
                    + "Map each one to the closest existing category or use encoding_evasion."),
    TARGET_WEAK_SPOTS("target_weak_spots",
            "PRIORITY TARGETS: these categories have the lowest block rates in the current WAF:\n"
                    + "%s\n"
                    + "Generate techniques specifically targeting these weak areas with your most advanced evasion.");

    private final String wireName;
    private final String guidance;

    Strategy(String wireName, String guidance) {
        this.wireName = wireName;
        this.guidance = guidance;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getGuidance() {
        return guidance;
    }

    /** Counter-strategy for the dominant failure mode of the previous cycle. */
    public static Strategy counterFor(FailureMode mode) {
        if (mode == null) return null;
        return switch (mode) {
            case CONFIDENCE_UNDERFLOW -> TARGET_WEAK_SPOTS;
            case PATTERN_GAP -> EMERGING_TECHNIQUES;
            case ENCODING_EVASION -> ENCODING_CHAINS;
            case CONTEXT_BLIND_SPOT -> CONTEXT_SHIFT;
            case SEMANTIC_MISS -> CROSS_CATEGORY;
        };
    }
}
