/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.telemetry;

import java.util.List;

public final class NoopExperimentTelemetry implements ExperimentTelemetry {
    public static final NoopExperimentTelemetry INSTANCE = new NoopExperimentTelemetry();

    private static final TelemetryScope NOOP_SCOPE = new TelemetryScope() {
        @Override
        public void recordSuccess() {}

        @Override
        public void recordFailure(Throwable error) {}

        @Override
        public void recordFallback(String usedKey) {}

        @Override
        public void recordVariant(String variant, String source) {}

        @Override
        public void close() {}
    };

    private NoopExperimentTelemetry() {}

    @Override
    public TelemetryScope startInvocation(Class<?> serviceType, String methodName, String selectorName,
                                          String preferredKey, List<String> candidateKeys) {
        return NOOP_SCOPE;
    }
}
