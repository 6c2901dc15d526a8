package org.caureq.hostwatch.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/** Agent report. Every metric is optional; an absent value is stored as null. */
public record IngestDTO(
        @NotBlank @Size(max = 255) String hostname,
        @Size(max = 100) String os,
        @DecimalMin("0.0") @DecimalMax("100.0") Double cpuPct,
        @DecimalMin("0.0") @DecimalMax("100.0") Double memPct,
        @DecimalMin("0.0") @DecimalMax("100.0") Double diskPct,
        @PositiveOrZero Integer memUsedMb,
        @PositiveOrZero Integer memTotalMb,
        @PositiveOrZero Double diskUsedGb,
        @PositiveOrZero Double diskTotalGb,
        Instant collectedAt // agent clock; server time when absent
) {}
