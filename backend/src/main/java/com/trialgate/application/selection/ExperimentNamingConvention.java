/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

/**
 * Derives selector names from a service type when a registration does not name one.
 */
public interface ExperimentNamingConvention {
    String featureFlagNameFor(Class<?> serviceType);

    String variantFlagNameFor(Class<?> serviceType);

    String configurationKeyFor(Class<?> serviceType);

    String kebabCaseNameFor(Class<?> serviceType);
}
