package org.caureq.hostwatch.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/** Implemented check kinds, keyed by {@link CheckEvaluator#kind()}. */
@Slf4j
@Component
public class CheckRegistry {
    private final Map<String, CheckEvaluator<?>> byKind;

    public CheckRegistry(List<CheckEvaluator<?>> evaluators) {
        Map<String, CheckEvaluator<?>> m = new LinkedHashMap<>();
        for (var e : evaluators) {
            var prev = m.putIfAbsent(e.kind(), e);
            if (prev != null) {
                throw new IllegalStateException("duplicate evaluator for kind " + e.kind()
                        + ": " + prev.getClass().getSimpleName() + ", " + e.getClass().getSimpleName());
            }
        }
        this.byKind = Collections.unmodifiableMap(m);
        log.info("[Alerts] check kinds available: {}", byKind.keySet());
    }

    public Optional<CheckEvaluator<?>> find(String kind) {
        return Optional.ofNullable(kind == null ? null : byKind.get(kind));
    }

    public boolean isImplemented(String kind) {
        return kind != null && byKind.containsKey(kind);
    }

    public Collection<CheckEvaluator<?>> all() {
        return byKind.values();
    }
}
