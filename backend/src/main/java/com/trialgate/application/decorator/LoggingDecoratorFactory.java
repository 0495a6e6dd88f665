/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs trial failures and rethrows them unchanged.
 */
public class LoggingDecoratorFactory implements ExperimentDecoratorFactory {
    private static final Logger log = LoggerFactory.getLogger(LoggingDecoratorFactory.class);

    @Override
    public ExperimentDecorator create() {
        return (context, next) -> {
            try {
                return next.proceed();
            } catch (Exception e) {
                if (!context.attempt().settle()) {
                    log.debug("Dropping late failure of abandoned trial={} error={}", context.trialKey(), e.toString());
                    throw e;
                }
                log.warn("Trial failed service={} method={} trial={} error={}",
                        context.serviceType().getSimpleName(), context.methodName(), context.trialKey(), e.toString());
                throw e;
            }
        };
    }
}
