/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.validation;

import java.util.List;

public record TrialConflict(
        TrialConflictType type,
        Class<?> serviceType,
        String description,
        List<String> experimentNames
) {
    public TrialConflict {
        experimentNames = experimentNames == null ? List.of() : List.copyOf(experimentNames);
    }
}
