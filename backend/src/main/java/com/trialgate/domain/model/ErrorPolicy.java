/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Rule for expanding a preferred trial key into the ordered candidates of a call.
 */
public record ErrorPolicy(
        ErrorPolicyType type,
        String fallbackKey,
        List<String> orderedKeys
) {
    public ErrorPolicy {
        Objects.requireNonNull(type, "type");
        orderedKeys = orderedKeys == null ? List.of() : List.copyOf(orderedKeys);
        if (type == ErrorPolicyType.REDIRECT_SPECIFIC && (fallbackKey == null || fallbackKey.isBlank())) {
            throw new IllegalArgumentException("REDIRECT_SPECIFIC requires a fallback key");
        }
        if (type == ErrorPolicyType.REDIRECT_ORDERED && orderedKeys.isEmpty()) {
            throw new IllegalArgumentException("REDIRECT_ORDERED requires at least one fallback key");
        }
    }

    public static ErrorPolicy throwing() {
        return new ErrorPolicy(ErrorPolicyType.THROW, null, List.of());
    }

    public static ErrorPolicy redirectDefault() {
        return new ErrorPolicy(ErrorPolicyType.REDIRECT_DEFAULT, null, List.of());
    }

    public static ErrorPolicy redirectAny() {
        return new ErrorPolicy(ErrorPolicyType.REDIRECT_ANY, null, List.of());
    }

    public static ErrorPolicy redirectSpecific(String fallbackKey) {
        return new ErrorPolicy(ErrorPolicyType.REDIRECT_SPECIFIC, fallbackKey, List.of());
    }

    public static ErrorPolicy redirectOrdered(List<String> orderedKeys) {
        return new ErrorPolicy(ErrorPolicyType.REDIRECT_ORDERED, null, orderedKeys);
    }

    /**
     * Trial keys this policy refers to besides the preferred one.
     */
    public List<String> referencedKeys() {
        return switch (type) {
            case REDIRECT_SPECIFIC -> List.of(fallbackKey);
            case REDIRECT_ORDERED -> orderedKeys;
            default -> List.of();
        };
    }
}
