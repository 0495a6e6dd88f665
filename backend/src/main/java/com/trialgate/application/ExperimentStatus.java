/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application;

import com.trialgate.domain.model.CircuitState;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record ExperimentStatus(
        String name,
        String serviceType,
        String defaultKey,
        List<String> trialKeys,
        String selectionMode,
        String selectorName,
        String errorPolicy,
        Instant startTime,
        Instant endTime,
        boolean active,
        boolean disabled,
        Set<String> disabledTrials,
        CircuitState circuitState
) {}
