/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.validation;

import com.trialgate.application.registration.Registration;
import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.FallbackAction;
import com.trialgate.domain.model.TimeoutPolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pre-flight validation of a whole set of registrations. Every conflict is reported; nothing
 * stops at the first one.
 */
public class TrialConflictDetector {

    public List<TrialConflict> detectConflicts(Collection<? extends Registration<?>> registrations) {
        Objects.requireNonNull(registrations, "registrations");
        List<TrialConflict> conflicts = new ArrayList<>();

        Map<Class<?>, List<Registration<?>>> byServiceType = new LinkedHashMap<>();
        for (Registration<?> registration : registrations) {
            byServiceType.computeIfAbsent(registration.serviceType(), k -> new ArrayList<>()).add(registration);
        }
        for (Map.Entry<Class<?>, List<Registration<?>>> group : byServiceType.entrySet()) {
            if (group.getValue().size() > 1) {
                validateGroup(group.getKey(), group.getValue(), conflicts);
            }
        }

        for (Registration<?> registration : registrations) {
            validateFallbackKeys(registration, conflicts);
        }
        return List.copyOf(conflicts);
    }

    public void validateOrThrow(Collection<? extends Registration<?>> registrations) {
        List<TrialConflict> conflicts = detectConflicts(registrations);
        if (!conflicts.isEmpty()) {
            throw new TrialConflictException(conflicts);
        }
    }

    private void validateGroup(Class<?> serviceType, List<Registration<?>> group, List<TrialConflict> conflicts) {
        List<Registration<?>> bounded = group.stream().filter(Registration::hasTimeBounds).toList();
        for (int i = 0; i < bounded.size(); i++) {
            for (int j = i + 1; j < bounded.size(); j++) {
                Registration<?> a = bounded.get(i);
                Registration<?> b = bounded.get(j);
                if (overlap(a, b)) {
                    conflicts.add(new TrialConflict(
                            TrialConflictType.OVERLAPPING_TIME_WINDOWS,
                            serviceType,
                            "Experiments for " + serviceType.getSimpleName() + " have overlapping time windows: "
                                    + window(a) + " and " + window(b),
                            List.of(a.experimentName(), b.experimentName())
                    ));
                }
            }
        }

        List<String> unbounded = group.stream()
                .filter(r -> !r.hasTimeBounds())
                .map(Registration::experimentName)
                .toList();
        if (unbounded.size() > 1) {
            conflicts.add(new TrialConflict(
                    TrialConflictType.DUPLICATE_SERVICE_REGISTRATION,
                    serviceType,
                    "Multiple experiments registered for " + serviceType.getSimpleName() + " without time bounds to tell them apart",
                    unbounded
            ));
        }
    }

    private void validateFallbackKeys(Registration<?> registration, List<TrialConflict> conflicts) {
        for (String key : registration.errorPolicy().referencedKeys()) {
            if (!registration.trials().containsKey(key)) {
                conflicts.add(invalidKey(registration, key, "error policy " + registration.errorPolicy().type()));
            }
        }

        TimeoutPolicy timeout = registration.timeoutPolicy();
        if (timeout != null && timeout.onTimeout() == FallbackAction.FALLBACK_TO_SPECIFIC_TRIAL
                && !registration.trials().containsKey(timeout.fallbackKey())) {
            conflicts.add(invalidKey(registration, timeout.fallbackKey(), "timeout fallback"));
        }

        CircuitBreakerOptions breaker = registration.circuitBreakerOptions();
        if (breaker != null && breaker.onCircuitOpen() == FallbackAction.FALLBACK_TO_SPECIFIC_TRIAL
                && !registration.trials().containsKey(breaker.fallbackKey())) {
            conflicts.add(invalidKey(registration, breaker.fallbackKey(), "circuit breaker fallback"));
        }
    }

    private static TrialConflict invalidKey(Registration<?> registration, String key, String source) {
        return new TrialConflict(
                TrialConflictType.INVALID_FALLBACK_KEY,
                registration.serviceType(),
                "Experiment " + registration.experimentName() + " references fallback key '" + key
                        + "' (" + source + ") which is not one of its trials " + registration.trialKeys(),
                List.of(registration.experimentName())
        );
    }

    /**
     * Windows that only touch at an endpoint do not overlap; a missing bound extends without limit.
     */
    static boolean overlap(Registration<?> a, Registration<?> b) {
        Instant aStart = a.startTime() == null ? Instant.MIN : a.startTime();
        Instant aEnd = a.endTime() == null ? Instant.MAX : a.endTime();
        Instant bStart = b.startTime() == null ? Instant.MIN : b.startTime();
        Instant bEnd = b.endTime() == null ? Instant.MAX : b.endTime();
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    private static String window(Registration<?> r) {
        return "[" + (r.startTime() == null ? "-inf" : r.startTime()) + ", " + (r.endTime() == null ? "+inf" : r.endTime()) + "]";
    }
}
