package org.caureq.hostwatch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.api.dto.IngestDTO;
import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.caureq.hostwatch.repo.HostRepo;
import org.caureq.hostwatch.repo.ReadingRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Stores agent reports. Alerting happens later, in the background sweep, never on this path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {
    private final HostRepo hostRepo;
    private final ReadingRepo readingRepo;
    private final Clock clock;

    @Transactional
    public Reading ingest(IngestDTO d) {
        var hostname = d.hostname().trim();
        var now = clock.instant();

        var host = hostRepo.findByHostnameIgnoreCase(hostname)
                .orElseGet(() -> {
                    log.info("new host registered: {}", hostname);
                    return Host.builder().hostname(hostname).active(true).build();
                });
        if (d.os() != null && !d.os().isBlank()) {
            host.setOs(d.os().trim());
        }
        host.setLastSeen(now);
        hostRepo.save(host);

        var r = readingRepo.save(Reading.builder()
                .host(host)
                .cpuPct(d.cpuPct())
                .memPct(d.memPct())
                .diskPct(d.diskPct())
                .memUsedMb(d.memUsedMb())
                .memTotalMb(d.memTotalMb())
                .diskUsedGb(d.diskUsedGb())
                .diskTotalGb(d.diskTotalGb())
                .collectedAt(d.collectedAt() == null ? now : d.collectedAt())
                .receivedAt(now)
                .build());

        log.debug("ingested {} cpu={} mem={} disk={}", hostname, d.cpuPct(), d.memPct(), d.diskPct());
        return r;
    }
}
