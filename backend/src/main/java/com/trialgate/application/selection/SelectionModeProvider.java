/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Strategy that picks the preferred trial key of a call. An empty result, a failed future or a
 * thrown exception all mean the default key is preferred.
 */
public interface SelectionModeProvider {

    String modeIdentifier();

    CompletableFuture<Optional<String>> selectTrialKey(SelectionContext context);

    String defaultSelectorName(Class<?> serviceType, ExperimentNamingConvention namingConvention);
}
