package com.hrms.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.support.SecurityTestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

    private ClientIpResolver resolver;

    @BeforeEach
    void setUp() {
        SecurityProperties properties = SecurityTestProperties.defaults();
        properties.getRateLimit().setTrustedProxies(List.of("10.0.0.1"));
        resolver = new ClientIpResolver(properties);
    }

    @Test
    void forwardingHeadersFromUntrustedPeerAreIgnored() {
        MockHttpServletRequest request = request("198.51.100.9");
        request.addHeader(ClientIpResolver.X_FORWARDED_FOR, "1.2.3.4");
        request.addHeader(ClientIpResolver.X_REAL_IP, "5.6.7.8");

        assertThat(resolver.resolve(request)).isEqualTo("198.51.100.9");
    }

    @Test
    void trustedProxyPrefersRealIp() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader(ClientIpResolver.X_FORWARDED_FOR, "1.2.3.4");
        request.addHeader(ClientIpResolver.X_REAL_IP, " 5.6.7.8 ");

        assertThat(resolver.resolve(request)).isEqualTo("5.6.7.8");
    }

    @Test
    void trustedProxyUsesFirstForwardedAddress() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader(ClientIpResolver.X_FORWARDED_FOR, "203.0.113.7, 10.0.0.2");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void trustedProxyWithoutHeadersFallsBackToPeer() {
        assertThat(resolver.resolve(request("10.0.0.1"))).isEqualTo("10.0.0.1");
    }

    @Test
    void contextCarriesUserAgentAndLanguage() {
        MockHttpServletRequest request = request("198.51.100.9");
        request.addHeader("User-Agent", "JUnit");
        request.addHeader("Accept-Language", "ko-KR");

        ClientContext context = resolver.contextOf(request);

        assertThat(context).isEqualTo(new ClientContext("198.51.100.9", "JUnit", "ko-KR"));
        assertThat(context.fingerprint())
                .isEqualTo(new ClientContext("198.51.100.9", "JUnit", "ko-KR").fingerprint())
                .isNotEqualTo(new ClientContext("198.51.100.10", "JUnit", "ko-KR").fingerprint());
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
