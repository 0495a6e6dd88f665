/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TimingDecoratorFactory implements ExperimentDecoratorFactory {
    private static final Logger log = LoggerFactory.getLogger(TimingDecoratorFactory.class);

    @Override
    public ExperimentDecorator create() {
        return (context, next) -> {
            long start = System.nanoTime();
            try {
                return next.proceed();
            } finally {
                if (context.attempt().settle()) {
                    long elapsedMicros = (System.nanoTime() - start) / 1_000;
                    log.info("Trial timing service={} method={} trial={} elapsedUs={}",
                            context.serviceType().getSimpleName(), context.methodName(), context.trialKey(), elapsedMicros);
                }
            }
        };
    }
}
