/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.activation;

import com.trialgate.application.registration.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Decides whether an experiment is live: inside its time window and accepted by its predicate.
 * A predicate that throws makes the experiment inactive.
 */
public class ActivationEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ActivationEvaluator.class);

    private final Clock clock;

    public ActivationEvaluator(Clock clock) {
        this.clock = clock;
    }

    public boolean isActive(Registration<?> registration) {
        return isActive(registration, clock.instant());
    }

    public boolean isActive(Registration<?> registration, Instant now) {
        if (registration.startTime() != null && now.isBefore(registration.startTime())) {
            return false;
        }
        if (registration.endTime() != null && now.isAfter(registration.endTime())) {
            return false;
        }
        BooleanSupplier predicate = registration.activationPredicate();
        if (predicate == null) {
            return true;
        }
        try {
            return predicate.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Activation predicate failed experiment={}, treating as inactive: {}",
                    registration.experimentName(), e.toString());
            return false;
        }
    }
}
