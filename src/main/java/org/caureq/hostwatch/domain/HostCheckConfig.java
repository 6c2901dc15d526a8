package org.caureq.hostwatch.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity
@Table(name = "host_check_configs", uniqueConstraints = {
        @UniqueConstraint(name = "uq_host_check", columnNames = {"host_id", "check_type_id"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class HostCheckConfig {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "host_id")
    private Host host;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "check_type_id")
    private CheckType checkType;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(length = 2000)
    private String params; // JSON object, overrides checkType.params per key

    private Instant updatedAt;

    @PrePersist @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
