/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.audit;

@FunctionalInterface
public interface AuditSink {
    void record(AuditEvent event);
}
