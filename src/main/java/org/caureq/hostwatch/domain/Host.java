package org.caureq.hostwatch.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity
@Table(name = "hosts", indexes = {
        @Index(name = "idx_host_last_seen", columnList = "last_seen")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Host {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String hostname;

    @Column(length = 100)
    private String os;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
