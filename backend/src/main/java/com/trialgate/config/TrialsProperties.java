/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.trialgate.domain.model.ErrorPolicyType;
import com.trialgate.domain.model.FallbackAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Experiments declared under {@code trials.experiments[]}. Trial keys map to bean names.
 * Times are ISO-8601 instants.
 */
@Validated
@ConfigurationProperties(prefix = "trials")
public record TrialsProperties(
        @Valid List<Experiment> experiments,
        Rollout rollout,
        StagedRollout stagedRollout
) {
    public TrialsProperties {
        experiments = experiments == null ? List.of() : List.copyOf(experiments);
    }

    public record Experiment(
            String name,
            @NotBlank String serviceType,
            @NotBlank String defaultKey,
            @NotEmpty Map<String, String> trials,
            String selectionMode,
            String selectorName,
            ErrorPolicy errorPolicy,
            String startTime,
            String endTime,
            Timeout timeout,
            CircuitBreaker circuitBreaker,
            List<String> decorators,
            boolean metrics
    ) {}

    public record ErrorPolicy(ErrorPolicyType type, String fallbackKey, List<String> orderedKeys) {}

    public record Timeout(Duration duration, FallbackAction onTimeout, String fallbackKey) {}

    public record CircuitBreaker(
            Double failureRatioThreshold,
            Integer minimumThroughput,
            Duration samplingDuration,
            Duration breakDuration,
            FallbackAction onCircuitOpen,
            String fallbackKey
    ) {}

    public record Rollout(Integer percentage, String includedKey, String excludedKey, String seed) {}

    /**
     * Stages start at ISO-8601 instants.
     */
    public record StagedRollout(@Valid List<Stage> stages, String includedKey, String excludedKey, String seed) {}

    public record Stage(@NotBlank String startsAt, Integer percentage, String description) {}
}
