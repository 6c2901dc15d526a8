package org.caureq.hostwatch.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.caureq.hostwatch.api.error.ApiError;
import org.caureq.hostwatch.api.error.ErrorCode;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Instant;

/** Writes an {@link ApiError} body from a servlet filter, outside of Spring MVC. */
final class ErrorResponses {
    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private ErrorResponses() {}

    static void write(HttpServletRequest req, HttpServletResponse res, int status, ErrorCode code, String message)
            throws IOException {
        res.setStatus(status);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        var body = new ApiError(Instant.now(), code, message, req.getHeader("X-Correlation-Id"), null);
        MAPPER.writeValue(res.getWriter(), body);
    }
}
