/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
