package org.caureq.hostwatch.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

/**
 * Catalog entry for a kind of check. {@code checkKey} selects the evaluator,
 * {@code params} holds the default parameters as a JSON object.
 */
@Entity
@Table(name = "check_types")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CheckType {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String checkKey;   // host_online, disk_space, memory_usage, cpu_usage

    @Column(nullable = false, unique = true, length = 120)
    private String name;

    @Column(length = 2000)
    private String params;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    @Builder.Default
    private Severity severity = Severity.L1;

    @Column(nullable = false)
    @Builder.Default
    private int cooldownMinutes = 60;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(length = 500)
    private String notes;

    private Instant updatedAt;

    @PrePersist @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
