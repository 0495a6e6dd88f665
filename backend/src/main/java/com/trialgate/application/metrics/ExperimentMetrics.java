/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.metrics;

import java.util.Map;

/**
 * Sink for experiment measurements. Tags are unordered string pairs; implementations must not
 * throw back into the calling invocation.
 */
public interface ExperimentMetrics {
    void incrementCounter(String name, Map<String, String> tags);

    void recordHistogram(String name, double value, Map<String, String> tags);

    void setGauge(String name, double value, Map<String, String> tags);

    void recordSummary(String name, double value, Map<String, String> tags);
}
