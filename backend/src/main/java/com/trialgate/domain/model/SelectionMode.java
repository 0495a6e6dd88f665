/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

/**
 * Strategy used to pick the preferred trial key of a call.
 */
public enum SelectionMode {
    BOOLEAN_FEATURE_FLAG("BooleanFeatureFlag"),
    CONFIGURATION_VALUE("ConfigurationValue"),
    STICKY_ROUTING("StickyRouting"),
    CUSTOM(null);

    private final String modeIdentifier;

    SelectionMode(String modeIdentifier) {
        this.modeIdentifier = modeIdentifier;
    }

    /**
     * Identifier of the built-in provider serving this mode; {@code null} for {@link #CUSTOM},
     * whose identifier is carried by the registration.
     */
    public String modeIdentifier() {
        return modeIdentifier;
    }
}
