/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

/**
 * Middleware around one trial invocation. Implementations call {@link Next#proceed()} to reach the
 * inner decorators and the implementation, and must let its exceptions through unless altering
 * the outcome is their documented purpose.
 */
public interface ExperimentDecorator {

    Object invoke(InvocationContext context, Next next) throws Exception;

    @FunctionalInterface
    interface Next {
        Object proceed() throws Exception;
    }
}
