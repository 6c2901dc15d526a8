package org.caureq.hostwatch.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.caureq.hostwatch.domain.Severity;
import org.caureq.hostwatch.service.alerts.AlertConfigService;
import org.caureq.hostwatch.service.alerts.AlertSweepScheduler;
import org.caureq.hostwatch.service.alerts.SweepReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Admin endpoints for the check catalog, per-host check configuration and manual sweeps. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminAlertsController {
    private final AlertConfigService cfg;
    private final AlertSweepScheduler scheduler;

    public record UpdateCheckTypeReq(Map<String, Object> params, Severity severity,
                                     @Min(0) Integer cooldownMinutes, Boolean enabled) {}

    public record HostCheckReq(Boolean enabled, Map<String, Object> params) {}

    public record HostReq(Boolean active) {}

    @GetMapping("/alerts/checks")
    public List<AlertConfigService.CheckTypeView> catalog() {
        return cfg.catalog();
    }

    @PatchMapping("/alerts/checks/{checkKey}")
    public AlertConfigService.CheckTypeView updateCheck(@PathVariable String checkKey,
                                                        @RequestBody @Valid UpdateCheckTypeReq body) {
        return cfg.updateCheckType(checkKey, body.params(), body.severity(), body.cooldownMinutes(), body.enabled());
    }

    @GetMapping("/alerts/hosts/{hostname}/checks")
    public List<AlertConfigService.HostCheckView> hostChecks(@PathVariable String hostname) {
        return cfg.hostChecks(hostname);
    }

    @PutMapping("/alerts/hosts/{hostname}/checks/{checkKey}")
    public AlertConfigService.HostCheckView putHostCheck(@PathVariable String hostname,
                                                         @PathVariable String checkKey,
                                                         @RequestBody @Valid HostCheckReq body) {
        return cfg.upsertHostCheck(hostname, checkKey, body.enabled(), body.params());
    }

    @PostMapping("/alerts/sweep")
    public SweepReport sweep() {
        return scheduler.triggerNow();
    }

    @GetMapping("/alerts/sweep/last")
    public ResponseEntity<SweepReport> lastSweep() {
        var r = scheduler.lastReport();
        return r == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(r);
    }

    @PatchMapping("/hosts/{hostname}")
    public ResponseEntity<?> updateHost(@PathVariable String hostname, @RequestBody HostReq body) {
        if (body.active() == null) throw new IllegalArgumentException("active is required");
        cfg.setHostActive(hostname, body.active());
        return ResponseEntity.noContent().build();
    }
}
