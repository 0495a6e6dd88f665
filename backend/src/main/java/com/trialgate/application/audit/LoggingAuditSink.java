/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditEvent event) {
        String details;
        try {
            details = objectMapper.writeValueAsString(event.details());
        } catch (JsonProcessingException e) {
            details = "{\"error\":\"details_serialization_failed\"}";
        }
        log.info("audit eventId={} type={} experiment={} trial={} actor={} correlationId={} details={}",
                event.eventId(),
                event.eventType(),
                event.experimentName(),
                event.selectedTrialKey(),
                event.actor(),
                event.correlationId(),
                details);
    }
}
