package tech.noetzold.waf_api.model;

import jakarta.persistence.*;
import lombok.*;
import tech.noetzold.waf_api.model.converter.RuleAuthorConverter;

import java.time.Instant;

/**
 * One immutable generation of the instruction pair handed to the fast and deep engines.
 * Rows are only ever inserted; the current rules are the row with the highest version.
 */
@Entity
@Table(name = "rule_versions", indexes = {
        @Index(name = "idx_rule_versions_version", columnList = "version", unique = true)
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "version", nullable = false, unique = true, updatable = false)
    private int version;

    @Column(name = "fast_prompt", nullable = false, updatable = false, columnDefinition = "text")
    private String fastPrompt;

    @Column(name = "deep_prompt", nullable = false, updatable = false, columnDefinition = "text")
    private String deepPrompt;

    @Column(name = "updated_at", nullable = false, updatable = false)
    private Instant updatedAt;

    @Convert(converter = RuleAuthorConverter.class)
    @Column(name = "updated_by", length = 20, nullable = false, updatable = false)
    private RuleAuthor updatedBy;

    @PrePersist
    public void prePersist() {
        if (updatedBy == null) updatedBy = RuleAuthor.SYSTEM;
    }
}
