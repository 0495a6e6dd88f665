/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.telemetry;

/**
 * Telemetry of one routed call. {@link #close()} may be called any number of times.
 */
public interface TelemetryScope extends AutoCloseable {
    void recordSuccess();

    void recordFailure(Throwable error);

    void recordFallback(String usedKey);

    void recordVariant(String variant, String source);

    @Override
    void close();
}
