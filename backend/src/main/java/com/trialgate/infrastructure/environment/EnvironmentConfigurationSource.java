/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.infrastructure.environment;

import com.trialgate.application.selection.ConfigurationSource;
import org.springframework.core.env.Environment;

import java.util.Optional;

public class EnvironmentConfigurationSource implements ConfigurationSource {

    private final Environment environment;

    public EnvironmentConfigurationSource(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(environment.getProperty(key));
    }
}
