package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.AttackCategory;

public record CategoryStat(AttackCategory category, long tested, long blocked) {

    public double blockRate() {
        return tested == 0 ? 0.0 : (double) blocked / tested;
    }
}
