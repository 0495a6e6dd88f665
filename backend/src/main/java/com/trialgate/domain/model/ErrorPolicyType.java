/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

public enum ErrorPolicyType {
    THROW,
    REDIRECT_DEFAULT,
    REDIRECT_ANY,
    REDIRECT_SPECIFIC,
    REDIRECT_ORDERED
}
