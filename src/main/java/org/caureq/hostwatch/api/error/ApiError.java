package org.caureq.hostwatch.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        String correlationId,
        Map<String,Object> details
) { }
