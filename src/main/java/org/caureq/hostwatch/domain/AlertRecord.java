package org.caureq.hostwatch.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One alert occurrence for a (host, check) pair. Never deleted.
 * <p>
 * {@code activeKey} is {@code "<hostId>:<checkTypeId>"} while the record is open or
 * acknowledged and {@code null} once resolved; its unique index lets the database reject a
 * second active alert for the same pair.
 */
@Entity
@Table(name = "alert_records", indexes = {
        @Index(name = "idx_alert_triggered", columnList = "triggered_at DESC"),
        @Index(name = "idx_alert_host_status", columnList = "host_id, status"),
        @Index(name = "idx_alert_check_status", columnList = "check_type_id, status")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uq_alert_active_key", columnNames = "active_key")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRecord {
    public static final int MESSAGE_MAX = 1000;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "host_id")
    private Host host;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "check_type_id")
    private CheckType checkType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reading_id")
    private Reading reading;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Severity severity;

    @Column(nullable = false, length = MESSAGE_MAX)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AlertStatus status;

    @Column(name = "active_key", length = 64)
    private String activeKey;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    private Instant lastNotifiedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static String activeKey(Long hostId, Long checkTypeId) {
        return hostId + ":" + checkTypeId;
    }

    public static String clip(String message) {
        if (message == null) return "";
        return message.length() > MESSAGE_MAX ? message.substring(0, MESSAGE_MAX) : message;
    }
}
