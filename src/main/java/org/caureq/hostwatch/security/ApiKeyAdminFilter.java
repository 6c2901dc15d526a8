package org.caureq.hostwatch.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.api.error.ErrorCode;
import org.caureq.hostwatch.config.AdminProps;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;

/** Guards /api/admin/*: admin key first, then the caller's address against the allowlist. */
@Slf4j
public class ApiKeyAdminFilter extends OncePerRequestFilter {
    static final String HEADER = "X-ADMIN-API-KEY";

    private final String adminKey;
    private final List<String> rules;

    public ApiKeyAdminFilter(AdminProps props) {
        this.adminKey = props.apiKey();
        this.rules = props.allowIpsOrDefault().stream().map(String::trim).toList();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        String k = req.getHeader(HEADER);
        if (adminKey == null || adminKey.isBlank() || !adminKey.equals(k)) {
            ErrorResponses.write(req, res, HttpStatus.UNAUTHORIZED.value(), ErrorCode.AUTH_REQUIRED,
                    "Missing or invalid " + HEADER);
            return;
        }

        String ip = req.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";
        if (!isAllowed(ip)) {
            log.warn("admin call from {} rejected: {} {}", ip, req.getMethod(), req.getRequestURI());
            ErrorResponses.write(req, res, HttpStatus.FORBIDDEN.value(), ErrorCode.FORBIDDEN, "IP not allowed: " + ip);
            return;
        }
        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        for (var rule : rules) {
            if ("*".equals(rule)) return true;
            if (rule.contains("/") ? inCidr(ip, rule) : rule.equals(ip)) return true;
        }
        return false;
    }

    // IPv4 only
    static boolean inCidr(String ip, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int prefix = Integer.parseInt(parts[1]);
            if (prefix < 0 || prefix > 32) return false;
            byte[] addr = InetAddress.getByName(ip).getAddress();
            byte[] net = InetAddress.getByName(parts[0]).getAddress();
            if (addr.length != 4 || net.length != 4) return false;
            int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
            return (toInt(addr) & mask) == (toInt(net) & mask);
        } catch (Exception e) {
            return false;
        }
    }

    private static int toInt(byte[] b) {
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }
}
