/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application;

import com.trialgate.application.audit.AuditEvent;
import com.trialgate.application.audit.AuditEventType;
import com.trialgate.application.proxy.ExperimentProxyFactory;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.KillSwitchProvider;
import com.trialgate.application.resilience.TrialCircuitBreaker;
import com.trialgate.application.routing.InvocationRouter;
import com.trialgate.application.routing.RoutingServices;
import com.trialgate.application.validation.TrialConflict;
import com.trialgate.application.validation.TrialConflictDetector;
import com.trialgate.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of the registered experiments and their routers, looked up by experiment name.
 * Also the entry point for kill-switch changes, so that every toggle is audited.
 */
public class ExperimentRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExperimentRegistry.class);

    private final Map<String, InvocationRouter<?>> routers;
    private final RoutingServices services;
    private final TrialConflictDetector conflictDetector;

    public ExperimentRegistry(Collection<? extends Registration<?>> registrations, RoutingServices services,
                              TrialConflictDetector conflictDetector) {
        this.services = services;
        this.conflictDetector = conflictDetector;

        Map<String, InvocationRouter<?>> byName = new LinkedHashMap<>();
        for (Registration<?> registration : registrations) {
            InvocationRouter<?> existing = byName.putIfAbsent(registration.experimentName(), new InvocationRouter<>(registration, services));
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate experiment name=" + registration.experimentName()
                                + ". Existing=" + existing.registration().serviceType().getName()
                                + ", new=" + registration.serviceType().getName()
                );
            }
        }
        this.routers = Collections.unmodifiableMap(byName);

        for (InvocationRouter<?> router : routers.values()) {
            audit(AuditEventType.EXPERIMENT_CREATED, router.registration(), null, Map.of(
                    "trials", List.copyOf(router.registration().trialKeys()),
                    "defaultKey", router.registration().defaultKey()
            ));
        }
        log.info("Experiment registry ready experiments={}", routers.keySet());
    }

    public List<Registration<?>> registrations() {
        List<Registration<?>> list = new ArrayList<>(routers.size());
        routers.values().forEach(r -> list.add(r.registration()));
        return list;
    }

    public Optional<Registration<?>> find(String experimentName) {
        InvocationRouter<?> router = routers.get(experimentName);
        return router == null ? Optional.empty() : Optional.of(router.registration());
    }

    public Registration<?> getRequired(String experimentName) {
        return find(experimentName)
                .orElseThrow(() -> new IllegalArgumentException("No experiment registered with name=" + experimentName));
    }

    public List<TrialConflict> conflicts() {
        return conflictDetector.detectConflicts(registrations());
    }

    public void validateOrThrow() {
        conflictDetector.validateOrThrow(registrations());
    }

    /**
     * Router serving a service type right now: the first active registration of that type, or the
     * first registration when none is active (its calls then go to the default trial).
     */
    public <T> InvocationRouter<T> routerFor(Class<T> serviceType) {
        InvocationRouter<T> fallback = null;
        for (InvocationRouter<?> router : routers.values()) {
            if (router.registration().serviceType() != serviceType) {
                continue;
            }
            // registration type checked above
            @SuppressWarnings("unchecked")
            InvocationRouter<T> typed = (InvocationRouter<T>) router;
            if (services.activation().isActive(typed.registration())) {
                return typed;
            }
            if (fallback == null) {
                fallback = typed;
            }
        }
        if (fallback == null) {
            throw new IllegalArgumentException("No experiment registered for service=" + serviceType.getName());
        }
        return fallback;
    }

    public <T> T proxyFor(Class<T> serviceType) {
        routerFor(serviceType);
        return ExperimentProxyFactory.create(serviceType, () -> routerFor(serviceType));
    }

    public List<ExperimentStatus> statuses() {
        return routers.values().stream().map(r -> status(r.registration())).toList();
    }

    public ExperimentStatus status(String experimentName) {
        return status(getRequired(experimentName));
    }

    public ExperimentStatus disableExperiment(String experimentName, String actor) {
        Registration<?> registration = getRequired(experimentName);
        registration.killSwitch().disableExperiment(registration.serviceType());
        audit(AuditEventType.EXPERIMENT_STOPPED, registration, actor, Map.of());
        return status(registration);
    }

    public ExperimentStatus enableExperiment(String experimentName, String actor) {
        Registration<?> registration = getRequired(experimentName);
        registration.killSwitch().enableExperiment(registration.serviceType());
        audit(AuditEventType.EXPERIMENT_STARTED, registration, actor, Map.of());
        return status(registration);
    }

    public ExperimentStatus disableTrial(String experimentName, String trialKey, String actor) {
        Registration<?> registration = getRequired(experimentName);
        requireTrial(registration, trialKey);
        registration.killSwitch().disableTrial(registration.serviceType(), trialKey);
        audit(AuditEventType.EXPERIMENT_MODIFIED, registration, actor, Map.of("trial", trialKey, "enabled", false));
        return status(registration);
    }

    public ExperimentStatus enableTrial(String experimentName, String trialKey, String actor) {
        Registration<?> registration = getRequired(experimentName);
        requireTrial(registration, trialKey);
        registration.killSwitch().enableTrial(registration.serviceType(), trialKey);
        audit(AuditEventType.EXPERIMENT_MODIFIED, registration, actor, Map.of("trial", trialKey, "enabled", true));
        return status(registration);
    }

    private static void requireTrial(Registration<?> registration, String trialKey) {
        if (!registration.trials().containsKey(trialKey)) {
            throw new IllegalArgumentException(
                    "Experiment " + registration.experimentName() + " has no trial '" + trialKey + "'"
            );
        }
    }

    private ExperimentStatus status(Registration<?> registration) {
        KillSwitchProvider killSwitch = registration.killSwitch();
        TrialCircuitBreaker breaker = registration.circuitBreaker();
        String selectorName = registration.selectorName();
        if (selectorName == null || selectorName.isBlank()) {
            selectorName = services.selectionModes().find(registration.modeIdentifier())
                    .map(p -> p.defaultSelectorName(registration.serviceType(), services.namingConvention()))
                    .orElse(null);
        }
        return new ExperimentStatus(
                registration.experimentName(),
                registration.serviceType().getName(),
                registration.defaultKey(),
                List.copyOf(registration.trialKeys()),
                registration.modeIdentifier(),
                selectorName,
                registration.errorPolicy().type().name(),
                registration.startTime(),
                registration.endTime(),
                services.activation().isActive(registration),
                killSwitch.isExperimentDisabled(registration.serviceType()),
                killSwitch.disabledTrials(registration.serviceType()),
                breaker == null ? CircuitState.CLOSED : breaker.state()
        );
    }

    private void audit(AuditEventType type, Registration<?> registration, String actor, Map<String, Object> details) {
        try {
            services.auditSink().record(AuditEvent.of(
                    type,
                    registration.experimentName(),
                    registration.serviceType(),
                    null,
                    actor,
                    details,
                    MDC.get("requestId")
            ));
        } catch (RuntimeException e) {
            log.debug("Audit sink failed experiment={} type={}: {}", registration.experimentName(), type, e.toString());
        }
    }
}
