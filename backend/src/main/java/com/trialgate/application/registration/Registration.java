/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.registration;

import com.trialgate.application.decorator.ExperimentDecoratorFactory;
import com.trialgate.application.decorator.MetricsDecoratorFactory;
import com.trialgate.application.metrics.ExperimentMetrics;
import com.trialgate.application.resilience.KillSwitchProvider;
import com.trialgate.application.resilience.NoopKillSwitchProvider;
import com.trialgate.application.resilience.TrialCircuitBreaker;
import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.ErrorPolicy;
import com.trialgate.domain.model.SelectionMode;
import com.trialgate.domain.model.TimeoutPolicy;
import com.trialgate.domain.model.TrialDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Frozen description of one experiment: the trials of a service type and the policies that govern
 * how calls are routed between them. Instances are created by {@link Builder#build()} and never
 * change afterwards; the circuit breaker they own is the only mutable state.
 *
 * <p>Fallback keys of the error policy are deliberately not checked here. A set of registrations
 * is validated as a whole by the conflict detector.
 */
public final class Registration<T> {

    private final Class<T> serviceType;
    private final String experimentName;
    private final Map<String, TrialDescriptor> trials;
    private final String defaultKey;
    private final SelectionMode selectionMode;
    private final String selectorName;
    private final String modeIdentifier;
    private final ErrorPolicy errorPolicy;
    private final Instant startTime;
    private final Instant endTime;
    private final BooleanSupplier activationPredicate;
    private final TimeoutPolicy timeoutPolicy;
    private final CircuitBreakerOptions circuitBreakerOptions;
    private final TrialCircuitBreaker circuitBreaker;
    private final KillSwitchProvider killSwitch;
    private final ExperimentMetrics metrics;
    private final List<ExperimentDecoratorFactory> decoratorFactories;

    private Registration(Builder<T> b) {
        this.serviceType = b.serviceType;
        this.experimentName = b.experimentName == null || b.experimentName.isBlank()
                ? b.serviceType.getSimpleName()
                : b.experimentName;
        this.trials = Collections.unmodifiableMap(new LinkedHashMap<>(b.trials));
        this.defaultKey = b.defaultKey;
        this.selectionMode = b.selectionMode;
        this.selectorName = b.selectorName;
        this.modeIdentifier = b.modeIdentifier;
        this.errorPolicy = b.errorPolicy;
        this.startTime = b.startTime;
        this.endTime = b.endTime;
        this.activationPredicate = b.activationPredicate;
        this.timeoutPolicy = b.timeoutPolicy;
        this.circuitBreakerOptions = b.circuitBreakerOptions;
        this.circuitBreaker = b.circuitBreakerOptions == null
                ? null
                : new TrialCircuitBreaker(this.experimentName, b.circuitBreakerOptions);
        this.killSwitch = b.killSwitch == null ? NoopKillSwitchProvider.INSTANCE : b.killSwitch;
        this.metrics = b.metrics;

        List<ExperimentDecoratorFactory> factories = new ArrayList<>(b.decoratorFactories);
        if (b.metrics != null) {
            factories.add(new MetricsDecoratorFactory(b.metrics));
        }
        this.decoratorFactories = List.copyOf(factories);
    }

    public static <T> Builder<T> builder(Class<T> serviceType) {
        return new Builder<>(serviceType);
    }

    public Class<T> serviceType() {
        return serviceType;
    }

    public String experimentName() {
        return experimentName;
    }

    public Map<String, TrialDescriptor> trials() {
        return trials;
    }

    public Set<String> trialKeys() {
        return trials.keySet();
    }

    public String defaultKey() {
        return defaultKey;
    }

    /**
     * Key that actually serves a candidate: the candidate itself when it names a trial, the default
     * key otherwise.
     */
    public String effectiveKey(String candidateKey) {
        return trials.containsKey(candidateKey) ? candidateKey : defaultKey;
    }

    public SelectionMode selectionMode() {
        return selectionMode;
    }

    /**
     * Explicit selector name, or {@code null} when the naming convention should derive it.
     */
    public String selectorName() {
        return selectorName;
    }

    /**
     * Identifier of the provider that serves this registration's selection mode.
     */
    public String modeIdentifier() {
        return selectionMode == SelectionMode.CUSTOM ? modeIdentifier : selectionMode.modeIdentifier();
    }

    public ErrorPolicy errorPolicy() {
        return errorPolicy;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public boolean hasTimeBounds() {
        return startTime != null || endTime != null;
    }

    public BooleanSupplier activationPredicate() {
        return activationPredicate;
    }

    public TimeoutPolicy timeoutPolicy() {
        return timeoutPolicy;
    }

    public CircuitBreakerOptions circuitBreakerOptions() {
        return circuitBreakerOptions;
    }

    public TrialCircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public KillSwitchProvider killSwitch() {
        return killSwitch;
    }

    public ExperimentMetrics metrics() {
        return metrics;
    }

    public List<ExperimentDecoratorFactory> decoratorFactories() {
        return decoratorFactories;
    }

    @Override
    public String toString() {
        return "Registration[" + experimentName + " -> " + serviceType.getName() + ", trials=" + trials.keySet() + "]";
    }

    public static final class Builder<T> {
        private final Class<T> serviceType;
        private final Map<String, TrialDescriptor> trials = new LinkedHashMap<>();
        private final List<ExperimentDecoratorFactory> decoratorFactories = new ArrayList<>();
        private String experimentName;
        private String defaultKey;
        private SelectionMode selectionMode = SelectionMode.BOOLEAN_FEATURE_FLAG;
        private String selectorName;
        private String modeIdentifier;
        private ErrorPolicy errorPolicy = ErrorPolicy.throwing();
        private Instant startTime;
        private Instant endTime;
        private BooleanSupplier activationPredicate;
        private TimeoutPolicy timeoutPolicy;
        private CircuitBreakerOptions circuitBreakerOptions;
        private KillSwitchProvider killSwitch;
        private ExperimentMetrics metrics;

        private Builder(Class<T> serviceType) {
            this.serviceType = Objects.requireNonNull(serviceType, "serviceType");
        }

        public Builder<T> experimentName(String experimentName) {
            this.experimentName = experimentName;
            return this;
        }

        public Builder<T> trial(String key, Class<? extends T> implementationType) {
            return trial(TrialDescriptor.of(key, implementationType));
        }

        public Builder<T> trial(TrialDescriptor descriptor) {
            if (trials.putIfAbsent(descriptor.key(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate trial key '" + descriptor.key() + "' for " + serviceType.getName());
            }
            return this;
        }

        public Builder<T> defaultTrial(String key, Class<? extends T> implementationType) {
            trial(key, implementationType);
            this.defaultKey = key;
            return this;
        }

        public Builder<T> defaultKey(String key) {
            this.defaultKey = key;
            return this;
        }

        public Builder<T> selection(SelectionMode mode, String selectorName) {
            this.selectionMode = Objects.requireNonNull(mode, "mode");
            this.selectorName = selectorName;
            return this;
        }

        public Builder<T> customSelection(String modeIdentifier, String selectorName) {
            this.selectionMode = SelectionMode.CUSTOM;
            this.modeIdentifier = modeIdentifier;
            this.selectorName = selectorName;
            return this;
        }

        public Builder<T> errorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy");
            return this;
        }

        public Builder<T> activeFrom(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder<T> activeUntil(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder<T> activeWhen(BooleanSupplier predicate) {
            this.activationPredicate = predicate;
            return this;
        }

        public Builder<T> timeout(TimeoutPolicy timeoutPolicy) {
            this.timeoutPolicy = timeoutPolicy;
            return this;
        }

        public Builder<T> circuitBreaker(CircuitBreakerOptions options) {
            this.circuitBreakerOptions = options;
            return this;
        }

        public Builder<T> killSwitch(KillSwitchProvider killSwitch) {
            this.killSwitch = killSwitch;
            return this;
        }

        public Builder<T> withMetrics(ExperimentMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder<T> decorator(ExperimentDecoratorFactory factory) {
            decoratorFactories.add(Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public Registration<T> build() {
            if (trials.isEmpty()) {
                throw new IllegalStateException("Experiment for " + serviceType.getName() + " declares no trials");
            }
            if (defaultKey == null || !trials.containsKey(defaultKey)) {
                throw new IllegalStateException(
                        "Default key '" + defaultKey + "' is not a trial of " + serviceType.getName() + ": " + trials.keySet()
                );
            }
            if (selectionMode == SelectionMode.CUSTOM && (modeIdentifier == null || modeIdentifier.isBlank())) {
                throw new IllegalStateException("Custom selection for " + serviceType.getName() + " needs a mode identifier");
            }
            if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
                throw new IllegalStateException(
                        "Experiment for " + serviceType.getName() + " ends (" + endTime + ") before it starts (" + startTime + ")"
                );
            }
            return new Registration<>(this);
        }
    }
}
