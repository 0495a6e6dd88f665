/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

/**
 * Creates a fresh decorator for each routed call.
 */
@FunctionalInterface
public interface ExperimentDecoratorFactory {
    ExperimentDecorator create();
}
