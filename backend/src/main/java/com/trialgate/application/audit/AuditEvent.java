/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record AuditEvent(
        String eventId,
        Instant timestamp,
        AuditEventType eventType,
        String experimentName,
        String serviceType,
        String actor,
        String selectedTrialKey,
        Map<String, Object> details,
        String correlationId
) {
    public AuditEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eventType, "eventType");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEvent of(
            AuditEventType type,
            String experimentName,
            Class<?> serviceType,
            String selectedTrialKey,
            String actor,
            Map<String, Object> details,
            String correlationId
    ) {
        return new AuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                type,
                experimentName,
                serviceType == null ? null : serviceType.getName(),
                actor,
                selectedTrialKey,
                details,
                correlationId
        );
    }
}
