package tech.noetzold.waf_api.service.redteam;

public record CategoryBreakdown(int tested, int blocked, int bypassed, int errors) {

    static final CategoryBreakdown EMPTY = new CategoryBreakdown(0, 0, 0, 0);

    CategoryBreakdown add(AttackOutcome outcome) {
        if (outcome.isError()) {
            return new CategoryBreakdown(tested + 1, blocked, bypassed, errors + 1);
        }
        if (outcome.isBypass()) {
            return new CategoryBreakdown(tested + 1, blocked, bypassed + 1, errors);
        }
        return new CategoryBreakdown(tested + 1, blocked + 1, bypassed, errors);
    }
}
