/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.telemetry;

import java.util.List;

/**
 * Observes routed calls. One scope is opened per call of an active experiment.
 */
public interface ExperimentTelemetry {
    TelemetryScope startInvocation(
            Class<?> serviceType,
            String methodName,
            String selectorName,
            String preferredKey,
            List<String> candidateKeys
    );
}
