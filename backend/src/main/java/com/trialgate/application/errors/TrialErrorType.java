/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

public enum TrialErrorType {
    EXPERIMENT_DISABLED,
    TRIAL_DISABLED,
    CIRCUIT_OPEN,
    TIMEOUT
}
