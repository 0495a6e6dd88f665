/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.metrics;

import java.util.Map;

public final class NoopExperimentMetrics implements ExperimentMetrics {
    public static final NoopExperimentMetrics INSTANCE = new NoopExperimentMetrics();

    private NoopExperimentMetrics() {}

    @Override
    public void incrementCounter(String name, Map<String, String> tags) {}

    @Override
    public void recordHistogram(String name, double value, Map<String, String> tags) {}

    @Override
    public void setGauge(String name, double value, Map<String, String> tags) {}

    @Override
    public void recordSummary(String name, double value, Map<String, String> tags) {}
}
