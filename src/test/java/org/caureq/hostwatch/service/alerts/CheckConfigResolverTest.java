package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.CheckType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CheckConfigResolver")
class CheckConfigResolverTest {

    private final CheckRegistry registry = new CheckRegistry(List.of(
            new HostOnlineEvaluator(), new DiskSpaceEvaluator(), new MemoryUsageEvaluator(), new CpuUsageEvaluator()));
    private final CheckConfigResolver resolver = new CheckConfigResolver(registry);

    private CheckType type(String key, String params) {
        return CheckType.builder().id(1L).checkKey(key).name(key).params(params).build();
    }

    @Test
    @DisplayName("Host override replaces the default for the same key")
    void overrideWins() {
        var resolved = resolver.resolve(type("disk_space", "{\"threshold_pct\":90}"), "{\"threshold_pct\":75}");

        assertThat(resolved.params()).isEqualTo(new PercentThresholdEvaluator.ThresholdParams(75.0));
    }

    @Test
    @DisplayName("Keys missing from the override keep their default")
    void defaultsKept() {
        var merged = resolver.mergedParams(type("host_online", "{\"offline_threshold_minutes\":60,\"note\":\"x\"}"),
                "{\"note\":\"y\"}");

        assertThat(merged).containsEntry("offline_threshold_minutes", 60).containsEntry("note", "y");
        assertThat(resolver.resolve(type("host_online", "{\"offline_threshold_minutes\":60}"), null).params())
                .isEqualTo(new HostOnlineEvaluator.OfflineParams(60));
    }

    @Test
    @DisplayName("Unknown check kind is reported as such")
    void unknownKind() {
        assertThatThrownBy(() -> resolver.resolve(type("unknown_check", "{}"), null))
                .isInstanceOf(UnknownCheckKindException.class)
                .hasMessageContaining("unknown_check");
    }

    @Test
    @DisplayName("Malformed or non-object JSON is a configuration error")
    void malformedJson() {
        assertThatThrownBy(() -> resolver.resolve(type("disk_space", "{\"threshold_pct\":"), null))
                .isInstanceOf(InvalidCheckConfigException.class)
                .isNotInstanceOf(UnknownCheckKindException.class);
        assertThatThrownBy(() -> resolver.resolve(type("disk_space", "{\"threshold_pct\":90}"), "[1,2]"))
                .isInstanceOf(InvalidCheckConfigException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("Parameters round-trip through JSON for storage")
    void toJson() {
        assertThat(resolver.toJson(null)).isNull();
        assertThat(resolver.toJson(Map.of())).isNull();
        assertThat(resolver.parse("disk_space", resolver.toJson(Map.of("threshold_pct", 80))))
                .containsEntry("threshold_pct", 80);
    }
}
