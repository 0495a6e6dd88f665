/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.audit;

public enum AuditEventType {
    EXPERIMENT_CREATED,
    EXPERIMENT_STARTED,
    EXPERIMENT_STOPPED,
    EXPERIMENT_MODIFIED,
    VARIANT_SELECTED,
    FALLBACK_TRIGGERED,
    ERROR
}
