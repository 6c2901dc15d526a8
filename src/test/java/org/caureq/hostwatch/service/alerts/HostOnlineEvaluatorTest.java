package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("host_online check")
class HostOnlineEvaluatorTest {
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final HostOnlineEvaluator evaluator = new HostOnlineEvaluator();
    private final HostOnlineEvaluator.OfflineParams sixty = new HostOnlineEvaluator.OfflineParams(60);

    private Host hostSeen(Instant lastSeen) {
        return Host.builder().id(1L).hostname("db-01").lastSeen(lastSeen).build();
    }

    private Optional<Reading> anyReading(Instant collectedAt) {
        return Optional.of(Reading.builder().id(3L).collectedAt(collectedAt).receivedAt(collectedAt).build());
    }

    @Test
    @DisplayName("Host that never reported is alerting")
    void neverReported() {
        var v = evaluator.evaluate(hostSeen(null), Optional.empty(), sixty, NOW);

        assertThat(v.isAlerting()).isTrue();
        assertThat(v.message()).contains("never reported");
    }

    @Test
    @DisplayName("Silence exactly equal to the threshold does not alert")
    void boundaryIsOnline() {
        var seen = NOW.minus(Duration.ofMinutes(60));
        var v = evaluator.evaluate(hostSeen(seen), anyReading(seen), sixty, NOW);

        assertThat(v.outcome()).isEqualTo(Verdict.Outcome.OK);
    }

    @Test
    @DisplayName("Silence just over the threshold alerts")
    void pastBoundaryIsOffline() {
        var seen = NOW.minus(Duration.ofMinutes(60)).minusSeconds(1);
        var v = evaluator.evaluate(hostSeen(seen), anyReading(seen), sixty, NOW);

        assertThat(v.isAlerting()).isTrue();
        assertThat(v.message()).contains("offline for 60 minutes").contains("threshold: 60");
    }

    @Test
    @DisplayName("Falls back to the reading time when the host has no lastSeen")
    void fallsBackToReadingTime() {
        var v = evaluator.evaluate(hostSeen(null), anyReading(NOW.minus(Duration.ofHours(3))), sixty, NOW);

        assertThat(v.isAlerting()).isTrue();
    }

    @Test
    @DisplayName("Offline threshold must be a positive whole number")
    void parseRejectsBadThreshold() {
        assertThat(evaluator.parse(Map.of("offline_threshold_minutes", 15)).offlineThresholdMinutes()).isEqualTo(15);
        assertThatThrownBy(() -> evaluator.parse(Map.of("offline_threshold_minutes", 0)))
                .isInstanceOf(InvalidCheckConfigException.class);
        assertThatThrownBy(() -> evaluator.parse(Map.of("offline_threshold_minutes", 2.5)))
                .isInstanceOf(InvalidCheckConfigException.class);
        assertThatThrownBy(() -> evaluator.parse(Map.of("offline_threshold_minutes", true)))
                .isInstanceOf(InvalidCheckConfigException.class);
    }
}
