package com.hronboard.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Caller network details recorded on sessions.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    static final String REQUEST_ATTRIBUTE = ClientInfo.class.getName();
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final int USER_AGENT_MAX_LENGTH = 500;

    public static ClientInfo from(HttpServletRequest request) {
        Object cached = request.getAttribute(REQUEST_ATTRIBUTE);
        if (cached instanceof ClientInfo clientInfo) {
            return clientInfo;
        }
        return new ClientInfo(resolveIp(request), truncate(request.getHeader(HttpHeaders.USER_AGENT)));
    }

    private static String resolveIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            // first hop is the original client
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= USER_AGENT_MAX_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, USER_AGENT_MAX_LENGTH);
    }
}
