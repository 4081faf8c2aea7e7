package tech.noetzold.waf_api.model;

import lombok.*;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatsResponse {
    private long total_requests;
    private long blocked_requests;
    private long total_threats;
    private long threats_blocked;
    private double block_rate;
    private int rules_version;
}
