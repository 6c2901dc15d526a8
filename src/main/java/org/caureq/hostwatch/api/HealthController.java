package org.caureq.hostwatch.api;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Unauthenticated health check for agents and load balancers. Reports the aggregate actuator
 * health, which includes a database connection check.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {
    private final HealthEndpoint health;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        var status = health.health().getStatus();
        boolean ok = Status.UP.equals(status);
        return ResponseEntity.status(ok ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("ok", ok, "status", status.getCode()));
    }
}
