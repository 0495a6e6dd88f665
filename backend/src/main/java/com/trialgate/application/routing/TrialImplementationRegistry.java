/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory resolver for trial instances registered by hand.
 */
public class TrialImplementationRegistry implements ImplementationResolver {

    private final Map<Class<?>, Map<String, Object>> implementations = new ConcurrentHashMap<>();

    public <T> TrialImplementationRegistry register(Class<T> serviceType, String trialKey, T implementation) {
        Objects.requireNonNull(implementation, "implementation");
        Object existing = implementations
                .computeIfAbsent(serviceType, k -> new ConcurrentHashMap<>())
                .putIfAbsent(trialKey, implementation);
        if (existing != null && existing != implementation) {
            throw new IllegalStateException(
                    "Duplicate implementation for service=" + serviceType.getName() + " trial=" + trialKey
                            + ". Existing=" + existing.getClass().getName()
                            + ", new=" + implementation.getClass().getName()
            );
        }
        return this;
    }

    @Override
    public Object resolve(Class<?> serviceType, String trialKey) {
        Map<String, Object> byKey = implementations.get(serviceType);
        Object impl = byKey == null ? null : byKey.get(trialKey);
        if (impl == null) {
            throw new IllegalArgumentException("No implementation registered for service=" + serviceType.getName() + " trial=" + trialKey);
        }
        return impl;
    }
}
