/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import com.trialgate.domain.model.SelectionMode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class ConfigurationValueProvider implements SelectionModeProvider {

    private final ConfigurationSource configuration;

    public ConfigurationValueProvider(ConfigurationSource configuration) {
        this.configuration = configuration;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.CONFIGURATION_VALUE.modeIdentifier();
    }

    @Override
    public CompletableFuture<Optional<String>> selectTrialKey(SelectionContext context) {
        Optional<String> value = configuration.get(context.selectorName())
                .map(String::trim)
                .filter(v -> !v.isEmpty());
        return CompletableFuture.completedFuture(value);
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention) {
        return namingConvention.configurationKeyFor(serviceType);
    }
}
