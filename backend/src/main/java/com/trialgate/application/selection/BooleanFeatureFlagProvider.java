/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import com.trialgate.domain.model.SelectionMode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Maps an on/off flag onto the trial keys {@code "true"} and {@code "false"}. An undefined flag
 * leaves the choice to the default key.
 */
public class BooleanFeatureFlagProvider implements SelectionModeProvider {
    public static final String ENABLED_KEY = "true";
    public static final String DISABLED_KEY = "false";

    private final FeatureFlagSource flags;

    public BooleanFeatureFlagProvider(FeatureFlagSource flags) {
        this.flags = flags;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.BOOLEAN_FEATURE_FLAG.modeIdentifier();
    }

    @Override
    public CompletableFuture<Optional<String>> selectTrialKey(SelectionContext context) {
        Optional<String> key = flags.isEnabled(context.selectorName())
                .map(enabled -> enabled ? ENABLED_KEY : DISABLED_KEY);
        return CompletableFuture.completedFuture(key);
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention) {
        return namingConvention.featureFlagNameFor(serviceType);
    }
}
