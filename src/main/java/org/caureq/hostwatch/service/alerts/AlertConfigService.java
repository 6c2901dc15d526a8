package org.caureq.hostwatch.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.domain.CheckType;
import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.HostCheckConfig;
import org.caureq.hostwatch.domain.Severity;
import org.caureq.hostwatch.repo.CheckTypeRepo;
import org.caureq.hostwatch.repo.HostCheckConfigRepo;
import org.caureq.hostwatch.repo.HostRepo;
import org.caureq.hostwatch.service.NotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Check catalog and per-host check configuration, as edited through the admin API.
 * Parameters are validated here, before they are stored, by resolving them exactly as a sweep
 * would. Changes take effect on the next sweep and never touch existing alert records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertConfigService {
    private final HostRepo hostRepo;
    private final CheckTypeRepo checkTypeRepo;
    private final HostCheckConfigRepo configRepo;
    private final CheckRegistry registry;
    private final CheckConfigResolver resolver;

    public record CheckTypeView(String checkKey, String name, Map<String, Object> params, Severity severity,
                                int cooldownMinutes, boolean enabled, boolean implemented, String notes) {}

    public record HostCheckView(String hostname, String checkKey, boolean enabled,
                                Map<String, Object> params, Map<String, Object> effectiveParams) {}

    @Transactional(readOnly = true)
    public List<CheckTypeView> catalog() {
        return checkTypeRepo.findAllByOrderByIdAsc().stream().map(this::toView).toList();
    }

    @Transactional
    public CheckTypeView updateCheckType(String checkKey, Map<String, Object> params, Severity severity,
                                         Integer cooldownMinutes, Boolean enabled) {
        var type = findType(checkKey);
        if (params != null) {
            var json = resolver.toJson(params);
            if (registry.isImplemented(checkKey)) {
                // defaults alone must be a complete, valid parameter set
                var defaultsOnly = CheckType.builder().checkKey(checkKey).params(json).build();
                resolver.resolve(defaultsOnly, null);
            }
            type.setParams(json);
        }
        if (severity != null) type.setSeverity(severity);
        if (cooldownMinutes != null) {
            if (cooldownMinutes < 0) throw new IllegalArgumentException("cooldownMinutes must be >= 0");
            type.setCooldownMinutes(cooldownMinutes);
        }
        if (enabled != null) type.setEnabled(enabled);
        var saved = checkTypeRepo.save(type);
        log.info("[Alerts] check type {} updated params={} severity={} cooldown={} enabled={}",
                checkKey, saved.getParams(), saved.getSeverity(), saved.getCooldownMinutes(), saved.isEnabled());
        return toView(saved);
    }

    @Transactional(readOnly = true)
    public List<HostCheckView> hostChecks(String hostname) {
        var host = findHost(hostname);
        return configRepo.findByHostOrderByIdAsc(host).stream().map(this::toView).toList();
    }

    /** Creates or replaces the configuration of one check on one host. */
    @Transactional
    public HostCheckView upsertHostCheck(String hostname, String checkKey, Boolean enabled, Map<String, Object> params) {
        var host = findHost(hostname);
        var type = findType(checkKey);
        var json = resolver.toJson(params);
        resolver.resolve(type, json);

        var cfg = configRepo.findByHostAndCheckType(host, type)
                .orElseGet(() -> HostCheckConfig.builder().host(host).checkType(type).build());
        cfg.setEnabled(enabled == null || enabled);
        cfg.setParams(json);
        var saved = configRepo.save(cfg);
        log.info("[Alerts] {} {} enabled={} params={}", host.getHostname(), checkKey, saved.isEnabled(), json);
        return toView(saved);
    }

    @Transactional
    public void setHostActive(String hostname, boolean active) {
        var host = findHost(hostname);
        host.setActive(active);
        hostRepo.save(host);
        log.info("[Alerts] host {} active={}", host.getHostname(), active);
    }

    private CheckTypeView toView(CheckType t) {
        return new CheckTypeView(t.getCheckKey(), t.getName(), resolver.parse(t.getCheckKey(), t.getParams()),
                t.getSeverity(), t.getCooldownMinutes(), t.isEnabled(), registry.isImplemented(t.getCheckKey()),
                t.getNotes());
    }

    private HostCheckView toView(HostCheckConfig c) {
        var type = c.getCheckType();
        return new HostCheckView(c.getHost().getHostname(), type.getCheckKey(), c.isEnabled(),
                resolver.parse(type.getCheckKey(), c.getParams()), resolver.mergedParams(type, c.getParams()));
    }

    private Host findHost(String hostname) {
        return hostRepo.findByHostnameIgnoreCase(hostname)
                .orElseThrow(() -> new NotFoundException("host not found: " + hostname));
    }

    private CheckType findType(String checkKey) {
        return checkTypeRepo.findByCheckKey(checkKey)
                .orElseThrow(() -> new NotFoundException("check type not found: " + checkKey));
    }
}
