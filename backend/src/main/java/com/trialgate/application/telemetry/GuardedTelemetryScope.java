/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wraps a scope so that a failing telemetry backend never reaches the routed call.
 */
public final class GuardedTelemetryScope implements TelemetryScope {
    private static final Logger log = LoggerFactory.getLogger(GuardedTelemetryScope.class);

    private final TelemetryScope delegate;

    private GuardedTelemetryScope(TelemetryScope delegate) {
        this.delegate = delegate;
    }

    public static TelemetryScope open(ExperimentTelemetry telemetry, Class<?> serviceType, String methodName,
                                      String selectorName, String preferredKey, List<String> candidateKeys) {
        try {
            TelemetryScope scope = telemetry.startInvocation(serviceType, methodName, selectorName, preferredKey, candidateKeys);
            return new GuardedTelemetryScope(scope);
        } catch (RuntimeException e) {
            log.debug("Telemetry start failed service={}: {}", serviceType.getSimpleName(), e.toString());
            return new GuardedTelemetryScope(null);
        }
    }

    @Override
    public void recordSuccess() {
        run(() -> delegate.recordSuccess(), "recordSuccess");
    }

    @Override
    public void recordFailure(Throwable error) {
        run(() -> delegate.recordFailure(error), "recordFailure");
    }

    @Override
    public void recordFallback(String usedKey) {
        run(() -> delegate.recordFallback(usedKey), "recordFallback");
    }

    @Override
    public void recordVariant(String variant, String source) {
        run(() -> delegate.recordVariant(variant, source), "recordVariant");
    }

    @Override
    public void close() {
        run(() -> delegate.close(), "close");
    }

    private void run(Runnable action, String operation) {
        if (delegate == null) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.debug("Telemetry {} failed: {}", operation, e.toString());
        }
    }
}
