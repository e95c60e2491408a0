package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "webhooks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Webhook {
    public static final String ALL_EVENTS = "all";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;
    @Column(nullable = false, length = 1000)
    private String url;
    /** Optional HMAC secret; when present payloads are signed. */
    private String secret;

    /** Alert type codes (e.g. high_risk) or "all". */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_events", joinColumns = @JoinColumn(name = "webhook_id"))
    @Column(name = "event_code", length = 32)
    @Builder.Default
    private Set<String> events = new LinkedHashSet<>();

    @Builder.Default
    private boolean active = true;
    private LocalDateTime lastTriggeredAt;
    private Integer lastStatusCode;
    private int consecutiveFailures;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean subscribesTo(AlertType type) {
        return events != null && (events.contains(ALL_EVENTS) || events.contains(type.code()));
    }
}
