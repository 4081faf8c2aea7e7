package tech.noetzold.waf_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "request_log")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "logged_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "raw_request", nullable = false, length = 500)
    private String rawRequest;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", length = 20, nullable = false)
    private Classification classification;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "classifier", length = 40, nullable = false)
    private String classifier;

    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    @Column(name = "attack_type", length = 60)
    private String attackType;

    @Column(name = "response_time_ms")
    private double responseTimeMs;

    @Column(name = "rules_version")
    private int rulesVersion;
}
