/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One attempt of a routed call: which trial is being invoked, for which method, with which
 * arguments. Arguments may contain {@code null}.
 */
public record InvocationContext(
        Class<?> serviceType,
        String methodName,
        String trialKey,
        List<Object> arguments,
        AttemptState attempt
) {
    public InvocationContext {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(trialKey, "trialKey");
        arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
        attempt = attempt == null ? new AttemptState() : attempt;
    }

    public InvocationContext(Class<?> serviceType, String methodName, String trialKey, List<Object> arguments) {
        this(serviceType, methodName, trialKey, arguments, new AttemptState());
    }

    /**
     * Same call aimed at another trial, as a new attempt.
     */
    public InvocationContext forTrial(String otherKey) {
        return new InvocationContext(serviceType, methodName, otherKey, arguments, new AttemptState());
    }
}
