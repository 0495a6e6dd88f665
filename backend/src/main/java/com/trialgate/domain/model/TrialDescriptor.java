/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

import java.util.Objects;

/**
 * One named candidate implementation of a service. {@code beanName} is optional and only used
 * when implementations are looked up in a Spring context.
 */
public record TrialDescriptor(
        String key,
        Class<?> implementationType,
        String beanName
) {
    public TrialDescriptor {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Trial key must not be blank");
        }
        if (implementationType == null && (beanName == null || beanName.isBlank())) {
            throw new IllegalArgumentException("Trial '" + key + "' needs an implementation type or a bean name");
        }
    }

    public static TrialDescriptor of(String key, Class<?> implementationType) {
        return new TrialDescriptor(key, Objects.requireNonNull(implementationType, "implementationType"), null);
    }

    public static TrialDescriptor ofBean(String key, String beanName) {
        return new TrialDescriptor(key, null, beanName);
    }
}
