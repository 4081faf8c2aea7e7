package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Strategy;

import java.util.List;
import java.util.Set;

public record ScoutReport(
        int discovered,
        List<Strategy> strategies,
        Set<AttackCategory> categoriesTouched,
        long generation
) {}
