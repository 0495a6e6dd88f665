/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selection providers by mode identifier. Lookups ignore case.
 */
public class SelectionModeRegistry {

    private final Map<String, SelectionModeProvider> providers = new ConcurrentHashMap<>();

    public SelectionModeRegistry(List<SelectionModeProvider> providers) {
        if (providers != null) {
            providers.forEach(this::register);
        }
    }

    public void register(SelectionModeProvider provider) {
        String id = provider.modeIdentifier();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Selection provider " + provider.getClass().getName() + " has no mode identifier");
        }
        SelectionModeProvider existing = providers.putIfAbsent(normalize(id), provider);
        if (existing != null && existing != provider) {
            throw new IllegalStateException(
                    "Duplicate selection provider for mode=" + id
                            + ". Existing=" + existing.getClass().getName()
                            + ", new=" + provider.getClass().getName()
            );
        }
    }

    public Optional<SelectionModeProvider> find(String modeIdentifier) {
        if (modeIdentifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(normalize(modeIdentifier)));
    }

    public Set<String> registeredModes() {
        Set<String> modes = new TreeSet<>();
        providers.values().forEach(p -> modes.add(p.modeIdentifier()));
        return Collections.unmodifiableSet(modes);
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
