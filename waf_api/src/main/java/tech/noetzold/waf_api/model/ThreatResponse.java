package tech.noetzold.waf_api.model;

import lombok.*;

import java.time.Instant;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThreatResponse {

    static final int PAYLOAD_PREVIEW = 200;

    private Long id;
    private String technique_name;
    private AttackCategory category;
    private String source;
    private String raw_payload;
    private Severity severity;
    private Instant discovered_at;
    private Instant tested_at;
    private boolean blocked;
    private Instant patched_at;

    public static ThreatResponse fromEntity(Technique t) {
        String payload = t.getRawPayload();
        if (payload != null && payload.length() > PAYLOAD_PREVIEW) {
            payload = payload.substring(0, PAYLOAD_PREVIEW);
        }
        return ThreatResponse.builder()
                .id(t.getId())
                .technique_name(t.getTechniqueName())
                .category(t.getCategory())
                .source(t.getSource())
                .raw_payload(payload)
                .severity(t.getSeverity())
                .discovered_at(t.getDiscoveredAt())
                .tested_at(t.getTestedAt())
                .blocked(t.isBlocked())
                .patched_at(t.getPatchedAt())
                .build();
    }
}
