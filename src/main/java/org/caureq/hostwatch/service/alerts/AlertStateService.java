package org.caureq.hostwatch.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.domain.*;
import org.caureq.hostwatch.repo.AlertRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Applies a verdict to the stored alert state of one (host, check) pair, in its own transaction.
 * <p>
 * The state is the presence of an active record (open or acknowledged). This service only ever
 * inserts open records or moves active ones to resolved; it never writes OPEN over ACKNOWLEDGED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertStateService {
    private final AlertRepo alertRepo;

    @Transactional
    public Transition reconcile(Host host, CheckType type, Verdict verdict, Reading latest, Instant now) {
        if (verdict.outcome() == Verdict.Outcome.NO_DATA) {
            log.debug("[Alerts] {} {} no data: {}", host.getHostname(), type.getCheckKey(), verdict.message());
            return Transition.NO_DATA;
        }
        var key = AlertRecord.activeKey(host.getId(), type.getId());
        var active = alertRepo.findByActiveKey(key);

        if (verdict.isAlerting()) {
            if (active.isPresent()) {
                var cutoff = now.minus(Duration.ofMinutes(Math.max(0, type.getCooldownMinutes())));
                int n = alertRepo.touchNotifiedIfDue(active.get().getId(), now, cutoff, AlertStatus.OPEN);
                log.debug("[Alerts] {} {} ongoing alert #{}{}", host.getHostname(), type.getCheckKey(),
                        active.get().getId(), n > 0 ? " (cooldown elapsed, notified)" : "");
                return n > 0 ? Transition.NOTIFIED : Transition.ONGOING;
            }
            var rec = alertRepo.saveAndFlush(AlertRecord.builder()
                    .host(host)
                    .checkType(type)
                    .reading(latest)
                    .severity(type.getSeverity())
                    .message(AlertRecord.clip(verdict.message()))
                    .status(AlertStatus.OPEN)
                    .activeKey(key)
                    .triggeredAt(now)
                    .lastNotifiedAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.info("[Alerts] OPEN #{} {} {} [{}]: {}", rec.getId(), host.getHostname(),
                    type.getCheckKey(), type.getSeverity(), verdict.message());
            return Transition.OPENED;
        }

        if (active.isEmpty()) {
            return Transition.UNCHANGED;
        }
        var rec = active.get();
        var message = AlertRecord.clip(rec.getMessage() + " -> RESOLVED: " + verdict.message());
        int n = alertRepo.resolveIfActive(rec.getId(), message, now, AlertStatus.RESOLVED, AlertStatus.ACTIVE);
        if (n == 0) {
            log.warn("[Alerts] alert #{} for {} {} changed concurrently, not resolved",
                    rec.getId(), host.getHostname(), type.getCheckKey());
            return Transition.UNCHANGED;
        }
        log.info("[Alerts] RESOLVED #{} {} {}: {}", rec.getId(), host.getHostname(), type.getCheckKey(), verdict.message());
        return Transition.RESOLVED;
    }
}
