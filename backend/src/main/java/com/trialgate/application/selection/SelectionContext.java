/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Input of one trial selection. Built fresh for every call.
 */
public record SelectionContext(
        Class<?> serviceType,
        String selectorName,
        String defaultKey,
        Set<String> trialKeys,
        CallScope callScope
) {
    public SelectionContext {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(defaultKey, "defaultKey");
        trialKeys = Set.copyOf(trialKeys);
        callScope = callScope == null ? CallScope.empty() : callScope;
    }

    /**
     * Per-call values a custom provider may inspect: the method being routed and its arguments.
     */
    public record CallScope(String methodName, List<Object> arguments) {
        public CallScope {
            arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        public static CallScope empty() {
            return new CallScope(null, List.of());
        }
    }
}
