package com.hronboard.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestTracingFilterTest {

    private final RequestTracingFilter filter = new RequestTracingFilter();

    @Test
    void propagatesIncomingRequestIdAndForwardedClient() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/templates");
        request.addHeader(RequestTracingFilter.REQUEST_ID_HEADER, "trace-42");
        request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> requestIdInChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> requestIdInChain.set(MDC.get(RequestTracingFilter.REQUEST_ID_MDC_KEY));

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader(RequestTracingFilter.REQUEST_ID_HEADER)).isEqualTo("trace-42");
        assertThat(requestIdInChain.get()).isEqualTo("trace-42");
        assertThat(ClientInfo.from(request).ipAddress()).isEqualTo("203.0.113.9");
        assertThat(MDC.get(RequestTracingFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void generatesRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(RequestTracingFilter.REQUEST_ID_HEADER)).isNotBlank();
    }

    @Test
    void longUserAgentIsTruncated() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "x".repeat(800));

        assertThat(ClientInfo.from(request).userAgent()).hasSize(500);
    }
}
