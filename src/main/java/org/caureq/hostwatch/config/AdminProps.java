package org.caureq.hostwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/** Admin API guard: shared key plus an IPv4 / CIDR allowlist ("*" allows everyone). */
@ConfigurationProperties(prefix = "admin")
public record AdminProps(String apiKey, List<String> allowIps) {
    public List<String> allowIpsOrDefault() {
        return allowIps == null || allowIps.isEmpty() ? List.of("127.0.0.1") : allowIps;
    }
}
