/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import com.trialgate.application.routing.StickyTrialRouter;
import com.trialgate.domain.model.SelectionMode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes each identity to the same trial on every call. The selector name acts as the experiment
 * name in the hash, so two experiments sharing a selector also share assignments.
 */
public class StickyRoutingProvider implements SelectionModeProvider {

    private final IdentityProvider identityProvider;

    public StickyRoutingProvider(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.STICKY_ROUTING.modeIdentifier();
    }

    @Override
    public CompletableFuture<Optional<String>> selectTrialKey(SelectionContext context) {
        Optional<String> key = identityProvider.currentIdentity()
                .filter(id -> !id.isBlank())
                .map(id -> StickyTrialRouter.selectTrial(id, context.selectorName(), context.trialKeys()));
        return CompletableFuture.completedFuture(key);
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention) {
        return namingConvention.featureFlagNameFor(serviceType);
    }
}
