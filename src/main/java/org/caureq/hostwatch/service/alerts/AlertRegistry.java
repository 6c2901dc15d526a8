package org.caureq.hostwatch.service.alerts;

import lombok.RequiredArgsConstructor;
import org.caureq.hostwatch.domain.AlertRecord;
import org.caureq.hostwatch.domain.AlertStatus;
import org.caureq.hostwatch.domain.Severity;
import org.caureq.hostwatch.repo.AlertRepo;
import org.caureq.hostwatch.repo.OffsetLimitRequest;
import org.caureq.hostwatch.service.NotFoundException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Read side of the alert store, plus operator acknowledgment. */
@Component
@RequiredArgsConstructor
public class AlertRegistry {
    public record Alert(Long id, String hostname, String checkKey, Severity severity, String message,
                        AlertStatus status, Instant triggeredAt, Instant lastNotifiedAt, Instant updatedAt) {}

    private final AlertRepo repo;
    private final Clock clock;

    /**
     * Acknowledges an open alert. An already acknowledged or resolved alert is left as is.
     *
     * @return 1 if the status changed, 0 otherwise
     */
    @Transactional
    public int ack(Long id) {
        if (!repo.existsById(id)) throw new NotFoundException("alert not found: " + id);
        return repo.acknowledgeIfOpen(id, clock.instant(), AlertStatus.ACKNOWLEDGED, AlertStatus.OPEN);
    }

    /** Query with optional filters and pagination (offset/limit), newest first. */
    @Transactional(readOnly = true)
    public List<Alert> query(String host, AlertStatus status, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        Pageable p = new OffsetLimitRequest(Math.max(0, offset), size,
                Sort.by(Sort.Direction.DESC, "triggeredAt", "id"));
        boolean byHost = host != null && !host.isBlank();
        var result = byHost && status != null ? repo.findByHost_HostnameIgnoreCaseAndStatus(host, status, p)
                : byHost ? repo.findByHost_HostnameIgnoreCase(host, p)
                : status != null ? repo.findByStatus(status, p)
                : repo.findAll(p);
        return result.stream().map(this::toDto).toList();
    }

    @Transactional(readOnly = true)
    public Map<AlertStatus, Long> summary() {
        Map<AlertStatus, Long> m = new EnumMap<>(AlertStatus.class);
        for (var s : AlertStatus.values()) m.put(s, repo.countByStatus(s));
        return m;
    }

    private Alert toDto(AlertRecord r) {
        return new Alert(r.getId(), r.getHost().getHostname(), r.getCheckType().getCheckKey(), r.getSeverity(),
                r.getMessage(), r.getStatus(), r.getTriggeredAt(), r.getLastNotifiedAt(), r.getUpdatedAt());
    }
}
