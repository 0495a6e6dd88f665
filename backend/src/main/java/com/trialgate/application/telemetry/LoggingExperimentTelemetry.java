/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Telemetry written to the application log. While a scope is open the {@code experiment} and
 * {@code trial} MDC keys describe the call; closing restores the previous values.
 */
public class LoggingExperimentTelemetry implements ExperimentTelemetry {
    private static final Logger log = LoggerFactory.getLogger(LoggingExperimentTelemetry.class);

    public static final String MDC_EXPERIMENT = "experiment";
    public static final String MDC_TRIAL = "trial";

    @Override
    public TelemetryScope startInvocation(Class<?> serviceType, String methodName, String selectorName,
                                          String preferredKey, List<String> candidateKeys) {
        return new LoggingScope(serviceType.getSimpleName(), methodName, selectorName, preferredKey, candidateKeys);
    }

    private static final class LoggingScope implements TelemetryScope {
        private final String service;
        private final String method;
        private final String previousExperiment;
        private final String previousTrial;
        private final long startedAt = System.nanoTime();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile String outcome = "unknown";

        LoggingScope(String service, String method, String selectorName, String preferredKey, List<String> candidates) {
            this.service = service;
            this.method = method;
            this.previousExperiment = MDC.get(MDC_EXPERIMENT);
            this.previousTrial = MDC.get(MDC_TRIAL);
            MDC.put(MDC_EXPERIMENT, service);
            MDC.put(MDC_TRIAL, preferredKey);
            log.debug("Experiment call start service={} method={} selector={} preferred={} candidates={}",
                    service, method, selectorName, preferredKey, candidates);
        }

        @Override
        public void recordSuccess() {
            outcome = "success";
        }

        @Override
        public void recordFailure(Throwable error) {
            outcome = "failure";
            log.warn("Experiment call failed service={} method={} error={}", service, method, String.valueOf(error));
        }

        @Override
        public void recordFallback(String usedKey) {
            MDC.put(MDC_TRIAL, usedKey);
            log.info("Experiment fallback service={} method={} trial={}", service, method, usedKey);
        }

        @Override
        public void recordVariant(String variant, String source) {
            log.debug("Experiment variant service={} variant={} source={}", service, variant, source);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
            log.debug("Experiment call end service={} method={} outcome={} elapsedMs={}", service, method, outcome, elapsedMs);
            restore(MDC_EXPERIMENT, previousExperiment);
            restore(MDC_TRIAL, previousTrial);
        }

        private static void restore(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
