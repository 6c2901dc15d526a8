package org.caureq.hostwatch.security;

import org.caureq.hostwatch.config.AdminProps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiKeyAdminFilter")
class ApiKeyAdminFilterTest {

    private static MockHttpServletRequest request(String key, String ip) {
        var req = new MockHttpServletRequest("GET", "/api/admin/alerts/checks");
        if (key != null) req.addHeader(ApiKeyAdminFilter.HEADER, key);
        req.setRemoteAddr(ip);
        return req;
    }

    @Test
    @DisplayName("CIDR matching")
    void cidr() {
        assertThat(ApiKeyAdminFilter.inCidr("10.1.2.3", "10.0.0.0/8")).isTrue();
        assertThat(ApiKeyAdminFilter.inCidr("11.1.2.3", "10.0.0.0/8")).isFalse();
        assertThat(ApiKeyAdminFilter.inCidr("192.168.1.77", "192.168.1.0/24")).isTrue();
        assertThat(ApiKeyAdminFilter.inCidr("192.168.2.1", "192.168.1.0/24")).isFalse();
        assertThat(ApiKeyAdminFilter.inCidr("8.8.8.8", "0.0.0.0/0")).isTrue();
        assertThat(ApiKeyAdminFilter.inCidr("10.0.0.1", "10.0.0.0/33")).isFalse();
        assertThat(ApiKeyAdminFilter.inCidr("10.0.0.1", "garbage")).isFalse();
    }

    @Test
    @DisplayName("Allowlist accepts exact addresses and ranges")
    void allowlist() {
        var f = new ApiKeyAdminFilter(new AdminProps("k", List.of("127.0.0.1", " 10.0.0.0/8 ")));
        assertThat(f.isAllowed("127.0.0.1")).isTrue();
        assertThat(f.isAllowed("10.20.30.40")).isTrue();
        assertThat(f.isAllowed("172.16.0.1")).isFalse();
    }

    @Test
    @DisplayName("Missing key gives 401 and stops the chain")
    void missingKey() throws Exception {
        var f = new ApiKeyAdminFilter(new AdminProps("k", List.of("*")));
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        f.doFilter(request(null, "127.0.0.1"), res, chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("AUTH_REQUIRED");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("Right key from a disallowed address gives 403")
    void forbiddenAddress() throws Exception {
        var f = new ApiKeyAdminFilter(new AdminProps("k", List.of("127.0.0.1")));
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        f.doFilter(request("k", "203.0.113.9"), res, chain);

        assertThat(res.getStatus()).isEqualTo(403);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("IPv6 loopback counts as 127.0.0.1")
    void loopback() throws Exception {
        var f = new ApiKeyAdminFilter(new AdminProps("k", List.of("127.0.0.1")));
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        f.doFilter(request("k", "0:0:0:0:0:0:0:1"), res, chain);

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isNotNull();
    }
}
