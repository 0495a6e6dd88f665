/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

/**
 * What a resilience wrapper does once it trips (deadline expired, circuit open).
 */
public enum FallbackAction {
    /** Fail the attempt; the error policy decides what happens next. */
    THROW_EXCEPTION,
    /** Invoke the default trial directly and end the call with its outcome. */
    FALLBACK_TO_DEFAULT,
    /** Invoke the configured fallback trial directly and end the call with its outcome. */
    FALLBACK_TO_SPECIFIC_TRIAL
}
