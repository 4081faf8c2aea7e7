package tech.noetzold.waf_api.model;

import jakarta.persistence.*;
import lombok.*;
import tech.noetzold.waf_api.model.converter.AttackCategoryConverter;
import tech.noetzold.waf_api.model.converter.SeverityConverter;

import java.time.Instant;

@Entity
@Table(name = "techniques", indexes = {
        @Index(name = "idx_techniques_name", columnList = "technique_name", unique = true)
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Technique {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "technique_name", length = 300, nullable = false, unique = true)
    private String techniqueName;

    @Convert(converter = AttackCategoryConverter.class)
    @Column(name = "category", length = 40, nullable = false)
    private AttackCategory category;

    @Column(name = "source", length = 120)
    private String source;

    @Column(name = "raw_payload", nullable = false, columnDefinition = "text")
    private String rawPayload;

    @Convert(converter = SeverityConverter.class)
    @Column(name = "severity", length = 20, nullable = false)
    private Severity severity;

    @Column(name = "discovered_at", nullable = false, updatable = false)
    private Instant discoveredAt;

    @Column(name = "tested_at")
    private Instant testedAt;

    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    @Column(name = "patched_at")
    private Instant patchedAt;

    @PrePersist
    public void prePersist() {
        if (category == null) category = AttackCategory.ENCODING_EVASION;
        if (severity == null) severity = Severity.MEDIUM;
    }
}
