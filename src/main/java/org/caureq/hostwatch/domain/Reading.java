package org.caureq.hostwatch.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

/** One metrics snapshot pushed by an agent. Rows are never updated. */
@Entity
@Table(name = "readings", indexes = {
        @Index(name = "idx_reading_host_ts", columnList = "host_id, collected_at DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Reading {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "host_id")
    private Host host;

    // null = not reported by the agent
    private Double cpuPct;
    private Double memPct;
    private Double diskPct;

    private Integer memUsedMb;
    private Integer memTotalMb;
    private Double diskUsedGb;
    private Double diskTotalGb;

    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;   // agent side

    @Column(nullable = false)
    private Instant receivedAt;    // server side
}
