package tech.noetzold.waf_api.service.classify;

import org.springframework.stereotype.Component;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.util.PercentDecoding;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stage 0: fixed regular-expression rule groups, one per attack category. Runs without
 * network access and always produces a verdict.
 */
@Component
public class PatternMatcher {

    static final double SAFE_CONFIDENCE = 0.85;
    static final double HIT_BONUS = 0.03;
    static final double MAX_CONFIDENCE = 0.99;

    private record RuleGroup(AttackCategory category, double baseConfidence, List<Pattern> patterns) {
    }

    private static final List<RuleGroup> RULES = List.of(
            group(AttackCategory.SQLI, 0.92,
                    "(?i)(\\b(union\\s+(all\\s+)?select|select\\s+.*\\s+from|insert\\s+into|update\\s+.*\\s+set|delete\\s+from|drop\\s+(table|database)|alter\\s+table)\\b)",
                    "(?i)(\\bor\\b\\s+['\"]?\\d+['\"]?\\s*=\\s*['\"]?\\d+|'\\s*or\\s*'[^']*'\\s*=\\s*')",
                    "(?i)(;\\s*(drop|alter|create|truncate|exec|execute)\\b)",
                    "(?i)(\\b(sleep|benchmark|waitfor\\s+delay|pg_sleep)\\s*\\()",
                    "(?i)('(\\s|%20)*--|\\b--\\s*$|#\\s*$)",
                    "(?i)(\\bhaving\\b\\s+\\d+\\s*=\\s*\\d+)",
                    "(?i)(load_file|into\\s+(out|dump)file|information_schema)"),
            group(AttackCategory.XSS, 0.90,
                    "(?i)(<\\s*script\\b[^>]*>|<\\s*/\\s*script\\s*>)",
                    "(?i)(\\bon(error|load|click|mouse|focus|blur|submit|change|key)\\s*=)",
                    "(?i)(javascript\\s*:)",
                    "(?i)(<\\s*(img|svg|iframe|embed|object|video|audio|source|body|input|form|details|marquee)\\b[^>]*(on\\w+\\s*=|src\\s*=\\s*['\"]?javascript))",
                    "(?i)(document\\s*\\.\\s*(cookie|location|write|domain)|window\\s*\\.\\s*location)",
                    "(?i)(<\\s*svg[^>]*\\bonload\\s*=)",
                    "(?i)(alert\\s*\\(|prompt\\s*\\(|confirm\\s*\\(|eval\\s*\\()",
                    "(?i)(fromCharCode|String\\.fromCharCode|atob\\s*\\()",
                    "(?i)(fetch\\s*\\(\\s*['\"]|XMLHttpRequest)"),
            group(AttackCategory.PATH_TRAVERSAL, 0.88,
                    "(\\.\\./|\\.\\.\\\\|%2e%2e%2f|%2e%2e/|\\.\\.%2f|%2e%2e%5c)",
                    "(?i)(/etc/(passwd|shadow|hosts|issue)|/proc/(self|version|cmdline))",
                    "(?i)(\\.\\.;/|\\.\\.%00|%00\\.)",
                    "(?i)(c:\\\\windows|c:/windows|boot\\.ini|win\\.ini)"),
            group(AttackCategory.COMMAND_INJECTION, 0.91,
                    "(;\\s*(ls|cat|whoami|id|uname|pwd|curl|wget|nc|ncat|bash|sh|cmd)\\b)",
                    "(\\|\\s*(ls|cat|whoami|id|uname|pwd|curl|wget|nc|bash|sh|cmd)\\b)",
                    "(`[^`]*`|\\$\\([^)]*\\))",
                    "(%0a|\\n)\\s*(ls|cat|whoami|id|curl|wget)",
                    "(?i)(\\b(eval|exec|system|passthru|popen|proc_open|shell_exec)\\s*\\()",
                    "(?i)(\\b__import__\\s*\\(|Runtime\\.exec)",
                    "(%26%26|&&)\\s*(whoami|id|cat|ls|curl|wget)"),
            group(AttackCategory.SSRF, 0.85,
                    "(?i)(169\\.254\\.169\\.254|metadata\\.google|100\\.100\\.100\\.200)",
                    "(?i)(127\\.0\\.0\\.1|0\\.0\\.0\\.0|localhost|0x7f000001|\\[::1\\]|\\[0:0:0:0:0:0:0:1\\])",
                    "(?i)(file://|gopher://|dict://|ftp://127|ftp://localhost)",
                    "(?i)(\\.internal\\b|\\.local\\b|\\.corp\\b|\\.home\\b)",
                    "(?i)(http://[0-9]+\\b(?!/)|http://0x)"),
            group(AttackCategory.XXE, 0.89,
                    "(?i)(<!DOCTYPE[^>]*\\[|<!ENTITY\\s+\\w+\\s+SYSTEM)",
                    "(?i)(SYSTEM\\s+['\"]file://|SYSTEM\\s+['\"]http://)",
                    "(?i)(&\\w+;.*<!ENTITY)"),
            group(AttackCategory.HEADER_INJECTION, 0.82,
                    "(%0d%0a|%0d|%0a|\\\\r\\\\n)",
                    "(?i)(Set-Cookie\\s*:|Location\\s*:.*%0d%0a)"),
            group(AttackCategory.AUTH_BYPASS, 0.87,
                    // JWT with alg "none"
                    "(?i)(eyJhbGciOiJub25lIi)",
                    "(?i)(admin['\"]?\\s*:\\s*['\"]?true|role['\"]?\\s*:\\s*['\"]?admin)",
                    "(?i)(\\bisAdmin\\b\\s*=\\s*true|\\brole\\b\\s*=\\s*admin)"),
            group(AttackCategory.ENCODING_EVASION, 0.80,
                    "(%25(?:2e|2f|5c|3c|3e|22|27))",
                    "(?i)(\\\\u003c|\\\\u003e|\\\\x3c|\\\\x3e)",
                    "(%00|%c0%ae)")
    );

    public Stage0Result classify(String rawRequest) {
        long start = System.nanoTime();
        String text = rawRequest == null ? "" : rawRequest;
        // raw text plus each of the first two decode layers
        String searchText = text + " " + PercentDecoding.unquote(text, 1) + " " + PercentDecoding.unquote(text, 2);

        RuleGroup best = null;
        double bestConfidence = 0.0;
        int bestHits = 0;
        for (RuleGroup rule : RULES) {
            int hits = 0;
            for (Pattern pattern : rule.patterns()) {
                if (pattern.matcher(searchText).find()) {
                    hits++;
                }
            }
            if (hits == 0) continue;

            double confidence = Math.min(rule.baseConfidence() + (hits - 1) * HIT_BONUS, MAX_CONFIDENCE);
            if (best == null || confidence > bestConfidence || (confidence == bestConfidence && hits > bestHits)) {
                best = rule;
                bestConfidence = confidence;
                bestHits = hits;
            }
        }

        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        if (best == null) {
            return new Stage0Result(Classification.SAFE, SAFE_CONFIDENCE, "none",
                    "No known attack patterns detected", elapsedMs, 0);
        }
        String reason = "Detected " + best.category().getDisplayName()
                + " (" + bestHits + " pattern" + (bestHits > 1 ? "s" : "") + " matched)";
        return new Stage0Result(Classification.MALICIOUS, bestConfidence, best.category().getWireName(),
                reason, elapsedMs, bestHits);
    }

    private static RuleGroup group(AttackCategory category, double baseConfidence, String... regexes) {
        List<Pattern> patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
        return new RuleGroup(category, baseConfidence, patterns);
    }
}
