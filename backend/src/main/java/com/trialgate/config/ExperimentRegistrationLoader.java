/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.trialgate.application.decorator.ExperimentDecoratorFactory;
import com.trialgate.application.decorator.LoggingDecoratorFactory;
import com.trialgate.application.decorator.TimingDecoratorFactory;
import com.trialgate.application.metrics.ExperimentMetrics;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.KillSwitchProvider;
import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.ErrorPolicy;
import com.trialgate.domain.model.ErrorPolicyType;
import com.trialgate.domain.model.SelectionMode;
import com.trialgate.domain.model.TimeoutPolicy;
import com.trialgate.domain.model.TrialDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns {@link TrialsProperties} into registrations. Every configuration defect is reported as an
 * {@link IllegalStateException} naming the experiment, so a bad file fails startup.
 */
public class ExperimentRegistrationLoader {
    private static final Logger log = LoggerFactory.getLogger(ExperimentRegistrationLoader.class);

    private final ClassLoader classLoader;
    private final KillSwitchProvider killSwitch;
    private final ExperimentMetrics metrics;

    public ExperimentRegistrationLoader(ClassLoader classLoader, KillSwitchProvider killSwitch, ExperimentMetrics metrics) {
        this.classLoader = classLoader;
        this.killSwitch = killSwitch;
        this.metrics = metrics;
    }

    public List<Registration<?>> load(TrialsProperties properties) {
        List<Registration<?>> registrations = new ArrayList<>();
        for (TrialsProperties.Experiment experiment : properties.experiments()) {
            registrations.add(load(experiment));
        }
        log.info("Loaded {} experiment(s) from configuration", registrations.size());
        return registrations;
    }

    Registration<?> load(TrialsProperties.Experiment experiment) {
        Class<?> serviceType;
        try {
            serviceType = ClassUtils.forName(experiment.serviceType(), classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalStateException("Unknown service type " + experiment.serviceType() + " in experiment " + label(experiment), e);
        }
        try {
            return build(serviceType, experiment);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid experiment " + label(experiment) + ": " + e.getMessage(), e);
        }
    }

    private <T> Registration<T> build(Class<T> serviceType, TrialsProperties.Experiment experiment) {
        Registration.Builder<T> builder = Registration.builder(serviceType)
                .experimentName(experiment.name())
                .defaultKey(experiment.defaultKey())
                .killSwitch(killSwitch)
                .activeFrom(parseInstant(experiment.startTime(), "startTime"))
                .activeUntil(parseInstant(experiment.endTime(), "endTime"));

        for (Map.Entry<String, String> trial : experiment.trials().entrySet()) {
            builder.trial(TrialDescriptor.ofBean(trial.getKey(), trial.getValue()));
        }

        applySelection(builder, experiment.selectionMode(), experiment.selectorName());
        builder.errorPolicy(toErrorPolicy(experiment.errorPolicy()));

        TrialsProperties.Timeout timeout = experiment.timeout();
        if (timeout != null && timeout.duration() != null) {
            builder.timeout(new TimeoutPolicy(timeout.duration(), timeout.onTimeout(), timeout.fallbackKey()));
        }

        TrialsProperties.CircuitBreaker cb = experiment.circuitBreaker();
        if (cb != null) {
            CircuitBreakerOptions defaults = CircuitBreakerOptions.defaults();
            builder.circuitBreaker(new CircuitBreakerOptions(
                    cb.failureRatioThreshold() == null ? defaults.failureRatioThreshold() : cb.failureRatioThreshold(),
                    cb.minimumThroughput() == null ? defaults.minimumThroughput() : cb.minimumThroughput(),
                    cb.samplingDuration() == null ? defaults.samplingDuration() : cb.samplingDuration(),
                    cb.breakDuration() == null ? defaults.breakDuration() : cb.breakDuration(),
                    cb.onCircuitOpen(),
                    cb.fallbackKey()
            ));
        }

        if (experiment.decorators() != null) {
            for (String name : experiment.decorators()) {
                builder.decorator(decorator(name));
            }
        }
        if (experiment.metrics()) {
            builder.withMetrics(metrics);
        }
        return builder.build();
    }

    private static void applySelection(Registration.Builder<?> builder, String mode, String selectorName) {
        if (mode == null || mode.isBlank()) {
            builder.selection(SelectionMode.BOOLEAN_FEATURE_FLAG, selectorName);
            return;
        }
        for (SelectionMode candidate : SelectionMode.values()) {
            if (candidate.modeIdentifier() != null && candidate.modeIdentifier().equalsIgnoreCase(mode.trim())) {
                builder.selection(candidate, selectorName);
                return;
            }
        }
        builder.customSelection(mode.trim(), selectorName);
    }

    private static ErrorPolicy toErrorPolicy(TrialsProperties.ErrorPolicy props) {
        if (props == null || props.type() == null) {
            return ErrorPolicy.throwing();
        }
        ErrorPolicyType type = props.type();
        return new ErrorPolicy(type, props.fallbackKey(), props.orderedKeys());
    }

    private static ExperimentDecoratorFactory decorator(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "logging" -> new LoggingDecoratorFactory();
            case "timing" -> new TimingDecoratorFactory();
            default -> throw new IllegalArgumentException("Unknown decorator '" + name + "' (expected logging or timing)");
        };
    }

    private static Instant parseInstant(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " is not an ISO-8601 instant: " + value, e);
        }
    }

    private static String label(TrialsProperties.Experiment experiment) {
        return experiment.name() == null ? experiment.serviceType() : experiment.name();
    }
}
