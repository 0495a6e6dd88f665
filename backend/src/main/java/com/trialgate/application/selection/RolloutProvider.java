/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class RolloutProvider implements SelectionModeProvider {
    public static final String MODE = "Rollout";

    private final IdentityProvider identityProvider;
    private final RolloutOptions options;

    public RolloutProvider(IdentityProvider identityProvider, RolloutOptions options) {
        this.identityProvider = identityProvider;
        this.options = options == null ? RolloutOptions.defaults() : options;
    }

    @Override
    public String modeIdentifier() {
        return MODE;
    }

    @Override
    public CompletableFuture<Optional<String>> selectTrialKey(SelectionContext context) {
        Optional<String> identity = identityProvider.currentIdentity().filter(id -> !id.isBlank());
        if (identity.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.ofNullable(options.excludedKey()));
        }
        boolean included = RolloutAllocator.isIncluded(identity.get(), context.selectorName(), options.percentage(), options.seed());
        String key = included ? options.includedKey() : options.excludedKey();
        return CompletableFuture.completedFuture(Optional.ofNullable(key));
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention) {
        return "Rollout:" + namingConvention.featureFlagNameFor(serviceType);
    }
}
