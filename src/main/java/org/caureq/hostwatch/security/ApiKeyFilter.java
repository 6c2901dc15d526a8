package org.caureq.hostwatch.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.caureq.hostwatch.api.error.ErrorCode;
import org.caureq.hostwatch.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Agents must send the shared X-API-KEY to post readings. */
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    static final String HEADER = "X-API-KEY";

    private final AppProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        String key = req.getHeader(HEADER);
        if (props.apiKey() == null || props.apiKey().isBlank() || !props.apiKey().equals(key)) {
            ErrorResponses.write(req, res, HttpStatus.UNAUTHORIZED.value(), ErrorCode.AUTH_REQUIRED,
                    "Missing or invalid " + HEADER);
            return;
        }
        chain.doFilter(req, res);
    }
}
