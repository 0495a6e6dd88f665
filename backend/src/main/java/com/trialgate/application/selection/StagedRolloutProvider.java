/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Percentage rollout driven by {@link StagedRolloutOptions}. Buckets come from
 * {@link RolloutAllocator}, so an identity included at one stage stays included as the
 * percentage grows.
 */
public class StagedRolloutProvider implements SelectionModeProvider {
    public static final String MODE = "StagedRollout";

    private final IdentityProvider identityProvider;
    private final StagedRolloutOptions options;
    private final Clock clock;

    public StagedRolloutProvider(IdentityProvider identityProvider, StagedRolloutOptions options, Clock clock) {
        this.identityProvider = identityProvider;
        this.options = options == null ? StagedRolloutOptions.of(null) : options;
        this.clock = clock;
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
        int percentage = options.percentageAt(clock.instant());
        boolean included = RolloutAllocator.isIncluded(identity.get(), context.selectorName(), percentage, options.seed());
        return CompletableFuture.completedFuture(Optional.ofNullable(included ? options.includedKey() : options.excludedKey()));
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention) {
        return "StagedRollout:" + namingConvention.featureFlagNameFor(serviceType);
    }
}
