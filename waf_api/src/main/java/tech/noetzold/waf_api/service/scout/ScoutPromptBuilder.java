package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Hint;
import tech.noetzold.waf_api.model.Strategy;
import tech.noetzold.waf_api.model.Technique;

import java.util.stream.Collectors;

final class ScoutPromptBuilder {

    static final int PAYLOAD_EXCERPT = 120;

    private ScoutPromptBuilder() {
    }

    static String difficultyLabel(long generation) {
        if (generation < 3) {
            return "intermediate evasion: focus on encoding tricks and syntax variants";
        } else if (generation < 8) {
            return "advanced evasion: use multi-layer encoding chains, parser differentials and context exploitation";
        }
        return "expert-level evasion: chain multiple techniques, exploit semantic gaps, use novel HTTP contexts and protocol-level tricks";
    }

    static String build(Strategy strategy, ReconBrief recon, Hint hint, int count) {
        String weak = weakCategories(recon);
        String guidance = strategy == Strategy.TARGET_WEAK_SPOTS
                ? String.format(strategy.getGuidance(), weak)
                : strategy.getGuidance();

        StringBuilder prompt = new StringBuilder();
        prompt.append("RECON BRIEF:\n");
        prompt.append("- Total techniques in DB: ").append(recon.totalTechniques()).append('\n');
        prompt.append("- Weakest categories:\n").append(weak).append('\n');
        prompt.append("- Under-explored categories: ").append(unexplored(recon)).append('\n');
        prompt.append("- Recent bypasses (unblocked):\n").append(recentBypasses(recon)).append('\n');
        if (hint != null && !hint.weakCategories().isEmpty()) {
            prompt.append("- Still weak after the last patch round: ")
                    .append(hint.weakCategories().stream().map(AttackCategory::getWireName).sorted()
                            .collect(Collectors.joining(", ")))
                    .append('\n');
        }
        prompt.append("- Generation: ").append(recon.generation())
                .append(" (cycle count, higher means more sophisticated output expected)\n\n");

        prompt.append("STRATEGY: ").append(strategy.getWireName()).append('\n');
        prompt.append(guidance).append("\n\n");

        prompt.append("REQUIREMENTS:\n");
        prompt.append("- Generate exactly ").append(count).append(" novel techniques\n");
        prompt.append("- Each must be a realistic raw HTTP request (not a fragment) with method, path, headers and body\n");
        prompt.append("- Difficulty level: ").append(difficultyLabel(recon.generation())).append('\n');
        prompt.append("- Do NOT repeat known technique names or payloads, they already exist in the database\n\n");
        prompt.append("Output ONLY the JSON array.");
        return prompt.toString();
    }

    private static String weakCategories(ReconBrief recon) {
        if (recon.weakCategories().isEmpty()) {
            return "  (no test data yet)";
        }
        return recon.weakCategories().stream()
                .map(s -> "  - " + s.category().getWireName() + ": " + s.blocked() + "/" + s.tested()
                        + " blocked (" + Math.round(s.blockRate() * 100) + "%)")
                .collect(Collectors.joining("\n"));
    }

    private static String unexplored(ReconBrief recon) {
        if (recon.unexplored().isEmpty()) {
            return "(all categories covered)";
        }
        return recon.unexplored().stream().map(AttackCategory::getWireName).collect(Collectors.joining(", "));
    }

    private static String recentBypasses(ReconBrief recon) {
        if (recon.recentBypasses().isEmpty()) {
            return "  (none yet)";
        }
        return recon.recentBypasses().stream()
                .map(ScoutPromptBuilder::bypassLine)
                .collect(Collectors.joining("\n"));
    }

    private static String bypassLine(Technique t) {
        String payload = t.getRawPayload();
        String excerpt = payload.length() > PAYLOAD_EXCERPT ? payload.substring(0, PAYLOAD_EXCERPT) : payload;
        return "  - " + t.getTechniqueName() + " [" + t.getCategory().getWireName() + "]: " + excerpt + "...";
    }
}
