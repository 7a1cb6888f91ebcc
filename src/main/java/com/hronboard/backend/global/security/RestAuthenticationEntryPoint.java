package com.hronboard.backend.global.security;

import java.io.IOException;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body;
        if (request.getAttribute(SessionAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE) instanceof ProblemException failure) {
            body = ProblemResponse.from(failure, request.getRequestURI());
        } else {
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, ProblemKind.UNAUTHORIZED.getDefaultCode(),
                    "Authentication required", request.getRequestURI());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
