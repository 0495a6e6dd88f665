/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

/**
 * Trial circuit state as reported by {@code TrialCircuitBreaker.state()}; a forced-open breaker reports {@link #OPEN}.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
