/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Optional;

public interface FeatureFlagSource {
    /**
     * @return the flag value, or empty when the flag is not defined
     */
    Optional<Boolean> isEnabled(String flagName);
}
