/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import com.trialgate.application.registration.Registration;
import com.trialgate.domain.model.ErrorPolicy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a preferred trial key into the ordered candidates of one call. The result always starts
 * with the preferred key and never repeats a key.
 */
public final class CandidateCascade {

    private CandidateCascade() {}

    public static List<String> build(String preferredKey, Registration<?> registration) {
        ErrorPolicy policy = registration.errorPolicy();
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(preferredKey);

        switch (policy.type()) {
            case THROW -> {
            }
            case REDIRECT_DEFAULT -> candidates.add(registration.defaultKey());
            case REDIRECT_ANY -> registration.trialKeys().stream()
                    .sorted()
                    .forEach(candidates::add);
            case REDIRECT_SPECIFIC -> candidates.add(policy.fallbackKey());
            case REDIRECT_ORDERED -> candidates.addAll(policy.orderedKeys());
        }
        return List.copyOf(candidates);
    }
}
