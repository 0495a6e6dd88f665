/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Optional;

public interface ConfigurationSource {
    Optional<String> get(String key);
}
