package org.caureq.hostwatch.api;

import lombok.RequiredArgsConstructor;
import org.caureq.hostwatch.domain.AlertStatus;
import org.caureq.hostwatch.service.alerts.AlertRegistry;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alerts read controller: list and filter alerts, acknowledge one.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertRegistry registry;

    @GetMapping
    public List<AlertRegistry.Alert> list(
            @RequestParam(value = "host", required = false) String host,
            @RequestParam(value = "status", required = false) AlertStatus status,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        return registry.query(host, status, lim, off);
    }

    @GetMapping("/summary")
    public Map<AlertStatus, Long> summary() {
        return registry.summary();
    }

    @PostMapping("/{id}/ack")
    public Map<String, Integer> ack(@PathVariable Long id) {
        return Map.of("acknowledged", registry.ack(id));
    }
}
