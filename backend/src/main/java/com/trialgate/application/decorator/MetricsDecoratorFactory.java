/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import com.trialgate.application.metrics.ExperimentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Records invocation counts, outcomes and durations of trial invocations. Outcomes of attempts
 * abandoned at their deadline are not recorded.
 */
public class MetricsDecoratorFactory implements ExperimentDecoratorFactory {
    private static final Logger log = LoggerFactory.getLogger(MetricsDecoratorFactory.class);

    public static final String INVOCATIONS = "experiment_invocations_total";
    public static final String DURATION = "experiment_duration_seconds";
    public static final String SUCCESSES = "experiment_success_total";
    public static final String ERRORS = "experiment_errors_total";

    private final ExperimentMetrics metrics;

    public MetricsDecoratorFactory(ExperimentMetrics metrics) {
        this.metrics = metrics;
    }

    public ExperimentMetrics metrics() {
        return metrics;
    }

    @Override
    public ExperimentDecorator create() {
        return (context, next) -> {
            Map<String, String> tags = Map.of(
                    "service", context.serviceType().getSimpleName(),
                    "method", context.methodName(),
                    "trial_key", context.trialKey()
            );
            safely(() -> metrics.incrementCounter(INVOCATIONS, tags));
            long start = System.nanoTime();
            try {
                Object result = next.proceed();
                if (context.attempt().settle()) {
                    safely(() -> metrics.incrementCounter(SUCCESSES, tags));
                    recordDuration(start, tags);
                }
                return result;
            } catch (Exception e) {
                if (context.attempt().settle()) {
                    safely(() -> metrics.incrementCounter(ERRORS, withErrorType(tags, e)));
                    recordDuration(start, tags);
                }
                throw e;
            }
        };
    }

    private void recordDuration(long start, Map<String, String> tags) {
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        safely(() -> metrics.recordHistogram(DURATION, seconds, tags));
    }

    private static Map<String, String> withErrorType(Map<String, String> tags, Exception e) {
        return Map.of(
                "service", tags.get("service"),
                "method", tags.get("method"),
                "trial_key", tags.get("trial_key"),
                "error_type", e.getClass().getSimpleName()
        );
    }

    private static void safely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.debug("Metrics sink failed: {}", e.toString());
        }
    }
}
