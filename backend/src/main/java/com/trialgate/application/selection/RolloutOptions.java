/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

/**
 * Percentage rollout: identities in the first {@code percentage} of 100 buckets get
 * {@code includedKey}, the rest get {@code excludedKey} (or the default key when it is null).
 */
public record RolloutOptions(
        int percentage,
        String includedKey,
        String excludedKey,
        String seed
) {
    public RolloutOptions {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Rollout percentage must be in [0, 100]: " + percentage);
        }
        if (includedKey == null || includedKey.isBlank()) {
            includedKey = "true";
        }
    }

    public static RolloutOptions defaults() {
        return new RolloutOptions(100, "true", null, null);
    }

    public static RolloutOptions percentage(int percentage) {
        return new RolloutOptions(percentage, "true", null, null);
    }
}
