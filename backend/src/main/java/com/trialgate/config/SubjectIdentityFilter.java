/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.trialgate.infrastructure.identity.MdcIdentityProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the request id and, when the caller sends one, the subject identity into the MDC for the
 * duration of the request. Sticky routing and rollouts read the identity from there.
 */
@Component
public class SubjectIdentityFilter extends OncePerRequestFilter {
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String SUBJECT_HEADER = "X-Subject-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String subjectId = request.getHeader(SUBJECT_HEADER);

        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        if (subjectId != null && !subjectId.isBlank()) {
            MDC.put(MdcIdentityProvider.MDC_KEY, subjectId.trim());
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
            MDC.remove(MdcIdentityProvider.MDC_KEY);
        }
    }
}
