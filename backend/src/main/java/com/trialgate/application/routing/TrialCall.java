/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

/**
 * The method call being routed, applied to whichever implementation serves it.
 */
@FunctionalInterface
public interface TrialCall<T, R> {
    R call(T implementation) throws Exception;
}
