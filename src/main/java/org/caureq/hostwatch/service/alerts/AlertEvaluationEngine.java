package org.caureq.hostwatch.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.HostCheckConfig;
import org.caureq.hostwatch.domain.Reading;
import org.caureq.hostwatch.repo.HostCheckConfigRepo;
import org.caureq.hostwatch.repo.HostRepo;
import org.caureq.hostwatch.repo.ReadingRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One sweep: every enabled check of every active host, reconciled against the alert store.
 * <p>
 * Failures are scoped. A bad configuration skips its (host, check) pair, a storage error fails
 * the pair (or the host, when its configs or reading cannot be loaded), and the sweep carries on.
 * Nothing thrown inside a sweep escapes {@link #runSweep(BooleanSupplier)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEvaluationEngine {
    private final HostRepo hostRepo;
    private final ReadingRepo readingRepo;
    private final HostCheckConfigRepo configRepo;
    private final CheckConfigResolver resolver;
    private final AlertStateService stateService;
    private final Clock clock;

    public SweepReport runSweep() {
        return runSweep(() -> false);
    }

    /**
     * @param cancelled polled between hosts and pairs; when true the sweep stops early.
     *                  Pairs already reconciled stay committed.
     */
    public SweepReport runSweep(BooleanSupplier cancelled) {
        var startedAt = clock.instant();
        var tally = new SweepReport.Tally();

        List<Host> hosts;
        try {
            hosts = hostRepo.findByActiveTrueOrderByIdAsc();
        } catch (DataAccessException e) {
            log.warn("[Alerts] sweep skipped, cannot list active hosts: {}", e.getMessage(), e);
            tally.failed++;
            return tally.finish(startedAt, clock.instant());
        }

        for (Host host : hosts) {
            if (cancelled.getAsBoolean()) {
                tally.aborted = true;
                break;
            }
            tally.hosts++;
            try {
                evaluateHost(host, startedAt, tally, cancelled);
            } catch (Exception e) {
                tally.failed++;
                log.warn("[Alerts] host {} skipped this sweep: {}", host.getHostname(), e.getMessage(), e);
            }
        }

        var report = tally.finish(startedAt, clock.instant());
        log.info("[Alerts] sweep done hosts={} checks={} opened={} resolved={} ongoing={} notified={} noData={} skipped={} failed={}{}",
                report.hosts(), report.checksRun(), report.opened(), report.resolved(), report.ongoing(),
                report.notified(), report.noData(), report.skipped(), report.failed(),
                report.aborted() ? " (aborted)" : "");
        return report;
    }

    private void evaluateHost(Host host, Instant now, SweepReport.Tally tally, BooleanSupplier cancelled) {
        var configs = configRepo.findEnabledForHost(host);
        if (configs.isEmpty()) {
            log.debug("[Alerts] no checks configured for {}", host.getHostname());
            return;
        }
        Optional<Reading> latest = readingRepo.findFirstByHostOrderByCollectedAtDescIdDesc(host);
        for (HostCheckConfig cfg : configs) {
            if (cancelled.getAsBoolean()) {
                tally.aborted = true;
                return;
            }
            evaluatePair(host, cfg, latest, now, tally);
        }
    }

    private void evaluatePair(Host host, HostCheckConfig cfg, Optional<Reading> latest, Instant now,
                              SweepReport.Tally tally) {
        var type = cfg.getCheckType();
        try {
            var check = resolver.resolve(type, cfg.getParams());
            var verdict = check.evaluate(host, latest, now);
            tally.checksRun++;
            tally.count(stateService.reconcile(host, type, verdict, latest.orElse(null), now));
        } catch (UnknownCheckKindException e) {
            tally.skipped++;
            log.warn("[Alerts] unknown check kind '{}' configured for {}, skipped", type.getCheckKey(), host.getHostname());
        } catch (InvalidCheckConfigException e) {
            tally.skipped++;
            log.warn("[Alerts] invalid config for {} {}: {}", host.getHostname(), type.getCheckKey(), e.getMessage());
        } catch (DataIntegrityViolationException e) {
            tally.failed++;
            log.error("[Alerts] integrity violation for {} {}: a second active alert was rejected, pair skipped",
                    host.getHostname(), type.getCheckKey(), e);
        } catch (DataAccessException e) {
            tally.failed++;
            log.warn("[Alerts] storage error for {} {}, retried next sweep: {}",
                    host.getHostname(), type.getCheckKey(), e.getMessage());
        } catch (RuntimeException e) {
            tally.failed++;
            log.error("[Alerts] check {} failed for {}", type.getCheckKey(), host.getHostname(), e);
        }
    }
}
