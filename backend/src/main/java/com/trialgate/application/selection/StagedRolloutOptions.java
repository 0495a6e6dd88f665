/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rollout whose percentage follows a schedule. The stage that started most recently sets the
 * percentage; before the first stage nobody is included.
 */
public record StagedRolloutOptions(
        List<Stage> stages,
        String includedKey,
        String excludedKey,
        String seed
) {
    public StagedRolloutOptions {
        stages = stages == null
                ? List.of()
                : stages.stream().sorted(Comparator.comparing(Stage::startsAt)).toList();
        if (includedKey == null || includedKey.isBlank()) {
            includedKey = "true";
        }
    }

    public static StagedRolloutOptions of(List<Stage> stages) {
        return new StagedRolloutOptions(stages, "true", null, null);
    }

    public int percentageAt(Instant now) {
        int percentage = 0;
        for (Stage stage : stages) {
            if (stage.startsAt().isAfter(now)) {
                break;
            }
            percentage = stage.percentage();
        }
        return percentage;
    }

    public record Stage(Instant startsAt, int percentage, String description) {
        public Stage {
            Objects.requireNonNull(startsAt, "startsAt");
            if (percentage < 0 || percentage > 100) {
                throw new IllegalArgumentException("Stage percentage must be in [0, 100]: " + percentage);
            }
        }

        public static Stage at(Instant startsAt, int percentage) {
            return new Stage(startsAt, percentage, null);
        }
    }
}
