package tech.noetzold.waf_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "agent_log", indexes = {
        @Index(name = "idx_agent_log_agent_action", columnList = "agent, action")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "logged_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "agent", length = 40, nullable = false)
    private String agent;

    @Column(name = "action", length = 60, nullable = false)
    private String action;

    @Column(name = "detail", columnDefinition = "text")
    private String detail;

    @Column(name = "success", nullable = false)
    private boolean success;
}
