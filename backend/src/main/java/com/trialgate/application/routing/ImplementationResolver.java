/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

/**
 * Supplies the instance that implements one trial of a service type.
 */
public interface ImplementationResolver {
    /**
     * @throws IllegalArgumentException when no implementation is known for the key
     */
    Object resolve(Class<?> serviceType, String trialKey);
}
