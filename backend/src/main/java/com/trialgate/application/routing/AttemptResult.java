/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

/**
 * Outcome of one candidate attempt. A terminal result ends the cascade whether it succeeded or not.
 */
record AttemptResult<R>(
        R value,
        Exception error,
        String servedBy,
        boolean terminal
) {
    static <R> AttemptResult<R> success(R value, String servedBy) {
        return new AttemptResult<>(value, null, servedBy, false);
    }

    static <R> AttemptResult<R> failure(Exception error, String trialKey) {
        return new AttemptResult<>(null, error, trialKey, false);
    }

    static <R> AttemptResult<R> terminal(AttemptResult<R> result) {
        return new AttemptResult<>(result.value, result.error, result.servedBy, true);
    }

    boolean succeeded() {
        return error == null;
    }
}
