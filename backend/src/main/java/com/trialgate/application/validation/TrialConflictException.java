/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.validation;

import java.util.List;
import java.util.stream.Collectors;

public class TrialConflictException extends RuntimeException {
    private final List<TrialConflict> conflicts;

    public TrialConflictException(List<TrialConflict> conflicts) {
        super(buildMessage(conflicts));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<TrialConflict> getConflicts() {
        return conflicts;
    }

    private static String buildMessage(List<TrialConflict> conflicts) {
        if (conflicts == null || conflicts.isEmpty()) {
            return "Trial conflicts were detected";
        }
        if (conflicts.size() == 1) {
            return "Trial conflict detected: " + conflicts.get(0).description();
        }
        return "Multiple trial conflicts detected:" + conflicts.stream()
                .map(c -> System.lineSeparator() + "  - " + c.description())
                .collect(Collectors.joining());
    }
}
