package org.caureq.hostwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProps(String apiKey, AlertsProps alerts) {
    /**
     * Alert evaluation engine. The interval is read once at startup; changing it needs a restart.
     */
    public record AlertsProps(Integer sweepIntervalSeconds, Integer initialDelaySeconds,
                              Integer shutdownTimeoutSeconds, Boolean schedulerEnabled,
                              Boolean seedCatalog) {
        public int sweepIntervalOrDefault() {
            return sweepIntervalSeconds == null || sweepIntervalSeconds <= 0 ? 60 : sweepIntervalSeconds;
        }
        public int initialDelayOrDefault() {
            return initialDelaySeconds == null || initialDelaySeconds < 0 ? 10 : initialDelaySeconds;
        }
        public int shutdownTimeoutOrDefault() {
            return shutdownTimeoutSeconds == null || shutdownTimeoutSeconds < 0 ? 30 : shutdownTimeoutSeconds;
        }
        public boolean schedulerOn() { return schedulerEnabled == null || schedulerEnabled; }
        public boolean seedOn() { return seedCatalog == null || seedCatalog; }
    }

    public AlertsProps alertsOrDefault() {
        return alerts == null ? new AlertsProps(null, null, null, null, null) : alerts;
    }
}
