package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Conditional updates and the single-active-alert constraint, against an embedded database.
 */
@DataJpaTest
@DisplayName("AlertRepo")
class AlertRepoTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired private AlertRepo alertRepo;
    @Autowired private HostRepo hostRepo;
    @Autowired private CheckTypeRepo checkTypeRepo;
    @Autowired private ReadingRepo readingRepo;
    @Autowired private HostCheckConfigRepo configRepo;

    private Host host;
    private CheckType disk;

    @BeforeEach
    void setUp() {
        host = hostRepo.save(Host.builder().hostname("h1").active(true).lastSeen(T0).build());
        disk = checkTypeRepo.save(CheckType.builder().checkKey("disk_space").name("Disk Space")
                .params("{\"threshold_pct\":90}").severity(Severity.L2).cooldownMinutes(60).build());
    }

    private AlertRecord open(Instant at) {
        return AlertRecord.builder().host(host).checkType(disk).severity(Severity.L2).message("disk critical")
                .status(AlertStatus.OPEN).activeKey(AlertRecord.activeKey(host.getId(), disk.getId()))
                .triggeredAt(at).lastNotifiedAt(at).createdAt(at).updatedAt(at).build();
    }

    @Test
    @DisplayName("A second active alert for the same pair is rejected by the database")
    void secondActiveRejected() {
        alertRepo.saveAndFlush(open(T0));

        assertThatThrownBy(() -> alertRepo.saveAndFlush(open(T0.plusSeconds(60))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Resolving frees the pair for a new alert; history is kept")
    void resolveThenReopen() {
        var first = alertRepo.saveAndFlush(open(T0));

        int n = alertRepo.resolveIfActive(first.getId(), "disk critical -> RESOLVED: ok", T0.plusSeconds(60),
                AlertStatus.RESOLVED, AlertStatus.ACTIVE);
        var second = alertRepo.saveAndFlush(open(T0.plusSeconds(120)));

        assertThat(n).isEqualTo(1);
        var resolved = alertRepo.findById(first.getId()).orElseThrow();
        assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.getActiveKey()).isNull();
        assertThat(resolved.getUpdatedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(alertRepo.findByActiveKey(AlertRecord.activeKey(host.getId(), disk.getId())))
                .get().extracting(AlertRecord::getId).isEqualTo(second.getId());
        assertThat(alertRepo.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Resolving an already resolved alert changes nothing")
    void resolveIsConditional() {
        var rec = alertRepo.saveAndFlush(open(T0));
        alertRepo.resolveIfActive(rec.getId(), "m1", T0.plusSeconds(1), AlertStatus.RESOLVED, AlertStatus.ACTIVE);

        int n = alertRepo.resolveIfActive(rec.getId(), "m2", T0.plusSeconds(2), AlertStatus.RESOLVED, AlertStatus.ACTIVE);

        assertThat(n).isZero();
        assertThat(alertRepo.findById(rec.getId()).orElseThrow().getMessage()).isEqualTo("m1");
    }

    @Test
    @DisplayName("Acknowledge only moves open alerts, and acknowledged alerts can still resolve")
    void acknowledge() {
        var rec = alertRepo.saveAndFlush(open(T0));

        assertThat(alertRepo.acknowledgeIfOpen(rec.getId(), T0.plusSeconds(5), AlertStatus.ACKNOWLEDGED, AlertStatus.OPEN)).isEqualTo(1);
        assertThat(alertRepo.acknowledgeIfOpen(rec.getId(), T0.plusSeconds(6), AlertStatus.ACKNOWLEDGED, AlertStatus.OPEN)).isZero();
        assertThat(alertRepo.findById(rec.getId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alertRepo.resolveIfActive(rec.getId(), "ok", T0.plusSeconds(7), AlertStatus.RESOLVED, AlertStatus.ACTIVE)).isEqualTo(1);
    }

    @Test
    @DisplayName("lastNotifiedAt is refreshed only once the cooldown has passed")
    void touchRespectsCooldown() {
        var rec = alertRepo.saveAndFlush(open(T0));
        var cooldown = Duration.ofMinutes(60);

        var early = T0.plus(Duration.ofMinutes(30));
        assertThat(alertRepo.touchNotifiedIfDue(rec.getId(), early, early.minus(cooldown), AlertStatus.OPEN)).isZero();

        var late = T0.plus(Duration.ofMinutes(60));
        assertThat(alertRepo.touchNotifiedIfDue(rec.getId(), late, late.minus(cooldown), AlertStatus.OPEN)).isEqualTo(1);
        assertThat(alertRepo.findById(rec.getId()).orElseThrow().getLastNotifiedAt()).isEqualTo(late);
    }

    @Test
    @DisplayName("Latest reading is picked by collection time")
    void latestReading() {
        readingRepo.save(Reading.builder().host(host).diskPct(50.0).collectedAt(T0.plusSeconds(120)).receivedAt(T0).build());
        readingRepo.save(Reading.builder().host(host).diskPct(70.0).collectedAt(T0.plusSeconds(60)).receivedAt(T0).build());

        assertThat(readingRepo.findFirstByHostOrderByCollectedAtDescIdDesc(host))
                .get().extracting(Reading::getDiskPct).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Only configs enabled on the host and in the catalog are evaluated")
    void enabledConfigs() {
        var mem = checkTypeRepo.save(CheckType.builder().checkKey("memory_usage").name("Memory Usage")
                .severity(Severity.L2).build());
        var cpu = checkTypeRepo.save(CheckType.builder().checkKey("cpu_usage").name("CPU Usage")
                .severity(Severity.L2).enabled(false).build());
        configRepo.save(HostCheckConfig.builder().host(host).checkType(disk).enabled(true).build());
        configRepo.save(HostCheckConfig.builder().host(host).checkType(mem).enabled(false).build());
        configRepo.save(HostCheckConfig.builder().host(host).checkType(cpu).enabled(true).build());

        assertThat(configRepo.findEnabledForHost(host))
                .extracting(c -> c.getCheckType().getCheckKey())
                .containsExactly("disk_space");
    }
}
