/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.validation;

public enum TrialConflictType {
    OVERLAPPING_TIME_WINDOWS,
    DUPLICATE_SERVICE_REGISTRATION,
    INVALID_FALLBACK_KEY
}
