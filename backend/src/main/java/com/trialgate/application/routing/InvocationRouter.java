/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import com.trialgate.application.audit.AuditEvent;
import com.trialgate.application.audit.AuditEventType;
import com.trialgate.application.decorator.DecoratorPipeline;
import com.trialgate.application.decorator.InvocationContext;
import com.trialgate.application.errors.CircuitOpenException;
import com.trialgate.application.errors.ExperimentDisabledException;
import com.trialgate.application.errors.TrialDisabledException;
import com.trialgate.application.errors.TrialTimeoutException;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.TrialCircuitBreaker;
import com.trialgate.application.selection.SelectionContext;
import com.trialgate.application.selection.SelectionModeProvider;
import com.trialgate.application.telemetry.GuardedTelemetryScope;
import com.trialgate.application.telemetry.TelemetryScope;
import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.ErrorPolicyType;
import com.trialgate.domain.model.FallbackAction;
import com.trialgate.domain.model.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Routes calls of one registration to its trials.
 *
 * <p>Per call: experiment kill switch, activation, selection of the preferred key, candidate
 * cascade, then one attempt per distinct trial until one succeeds. Each attempt passes through the trial
 * kill switch, the circuit breaker, the timeout and the decorator pipeline, in that order.
 * Attempt failures are kept as values until the cascade decides the call's outcome.
 */
public class InvocationRouter<T> {
    private static final Logger log = LoggerFactory.getLogger(InvocationRouter.class);
    private static final String MDC_REQUEST_ID = "requestId";

    private final Registration<T> registration;
    private final RoutingServices services;

    public InvocationRouter(Registration<T> registration, RoutingServices services) {
        this.registration = registration;
        this.services = services;
    }

    public Registration<T> registration() {
        return registration;
    }

    public <R> R invoke(String methodName, List<Object> arguments, TrialCall<T, R> call) throws Exception {
        Class<T> serviceType = registration.serviceType();
        if (registration.killSwitch().isExperimentDisabled(serviceType)) {
            throw new ExperimentDisabledException(serviceType);
        }

        DecoratorPipeline pipeline = DecoratorPipeline.build(registration.decoratorFactories());

        if (!services.activation().isActive(registration)) {
            InvocationContext context = new InvocationContext(serviceType, methodName, registration.defaultKey(), arguments);
            return invokeTrial(context, pipeline, call);
        }

        String modeIdentifier = registration.modeIdentifier();
        Optional<SelectionModeProvider> provider = services.selectionModes().find(modeIdentifier);
        String selectorName = selectorName(provider);
        String preferredKey = selectPreferredKey(provider, selectorName, methodName, arguments);
        List<String> candidates = CandidateCascade.build(preferredKey, registration);

        try (TelemetryScope scope = GuardedTelemetryScope.open(
                services.telemetry(), serviceType, methodName, selectorName, preferredKey, candidates)) {
            scope.recordVariant(preferredKey, modeIdentifier);
            audit(AuditEventType.VARIANT_SELECTED, preferredKey, Map.of("method", methodName, "selector", String.valueOf(selectorName)));

            String preferredTrial = registration.effectiveKey(preferredKey);
            Set<String> attempted = new HashSet<>();
            Exception lastError = null;
            for (String candidate : candidates) {
                if (!attempted.add(registration.effectiveKey(candidate))) {
                    continue;
                }
                AttemptResult<R> result = attempt(candidate, methodName, arguments, pipeline, call);
                if (result.succeeded()) {
                    if (!result.servedBy().equals(preferredTrial)) {
                        scope.recordFallback(result.servedBy());
                        audit(AuditEventType.FALLBACK_TRIGGERED, result.servedBy(), Map.of(
                                "method", methodName,
                                "preferredKey", preferredKey
                        ));
                    }
                    scope.recordSuccess();
                    return result.value();
                }

                lastError = result.error();
                if (result.terminal() || registration.errorPolicy().type() == ErrorPolicyType.THROW) {
                    break;
                }
                log.debug("Candidate failed experiment={} trial={} error={}, trying next",
                        registration.experimentName(), result.servedBy(), lastError.toString());
            }

            scope.recordFailure(lastError);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("method", methodName);
            details.put("candidates", candidates);
            details.put("error", lastError.getClass().getName());
            audit(AuditEventType.ERROR, preferredKey, details);
            throw lastError;
        }
    }

    private <R> AttemptResult<R> attempt(
            String candidate,
            String methodName,
            List<Object> arguments,
            DecoratorPipeline pipeline,
            TrialCall<T, R> call
    ) throws InterruptedException {
        Class<T> serviceType = registration.serviceType();
        String trialKey = registration.effectiveKey(candidate);
        InvocationContext context = new InvocationContext(serviceType, methodName, trialKey, arguments);

        if (registration.killSwitch().isTrialDisabled(serviceType, trialKey)) {
            return AttemptResult.failure(new TrialDisabledException(serviceType, trialKey), trialKey);
        }

        TrialCircuitBreaker breaker = registration.circuitBreaker();
        if (breaker != null && !breaker.tryAcquire()) {
            CircuitBreakerOptions options = breaker.options();
            log.debug("Circuit open experiment={} trial={} action={}", registration.experimentName(), trialKey, options.onCircuitOpen());
            return onFallbackAction(options.onCircuitOpen(), options.fallbackKey(), context, pipeline, call,
                    new CircuitOpenException(serviceType, trialKey));
        }

        long start = System.nanoTime();
        try {
            R value = invokeWithTimeout(context, pipeline, call);
            if (breaker != null) breaker.recordSuccess(System.nanoTime() - start);
            return AttemptResult.success(value, trialKey);
        } catch (InterruptedException e) {
            if (breaker != null) breaker.release();
            throw e;
        } catch (TrialTimeoutException e) {
            if (breaker != null) breaker.recordFailure(System.nanoTime() - start, e);
            TimeoutPolicy timeout = registration.timeoutPolicy();
            if (timeout == null || !context.attempt().isAbandoned()) {
                // thrown by the trial itself, not by the deadline
                return AttemptResult.failure(e, trialKey);
            }
            return onFallbackAction(timeout.onTimeout(), timeout.fallbackKey(), context, pipeline, call, e);
        } catch (Exception e) {
            if (breaker != null) breaker.recordFailure(System.nanoTime() - start, e);
            return AttemptResult.failure(e, trialKey);
        } catch (Error e) {
            if (breaker != null) breaker.recordFailure(System.nanoTime() - start, e);
            throw e;
        }
    }

    /**
     * {@code THROW_EXCEPTION} hands the error to the cascade; the fallback actions invoke their trial
     * directly, outside the breaker and the timeout, and end the cascade with its outcome.
     */
    private <R> AttemptResult<R> onFallbackAction(
            FallbackAction action,
            String fallbackKey,
            InvocationContext context,
            DecoratorPipeline pipeline,
            TrialCall<T, R> call,
            Exception cause
    ) throws InterruptedException {
        String target = switch (action) {
            case THROW_EXCEPTION -> null;
            case FALLBACK_TO_DEFAULT -> registration.defaultKey();
            case FALLBACK_TO_SPECIFIC_TRIAL -> registration.effectiveKey(fallbackKey);
        };
        if (target == null) {
            return AttemptResult.failure(cause, context.trialKey());
        }

        log.info("Direct fallback experiment={} from={} to={} reason={}",
                registration.experimentName(), context.trialKey(), target, cause.getClass().getSimpleName());
        try {
            R value = invokeTrial(context.forTrial(target), pipeline, call);
            return AttemptResult.terminal(AttemptResult.success(value, target));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            return AttemptResult.terminal(AttemptResult.failure(e, target));
        }
    }

    private <R> R invokeWithTimeout(InvocationContext context, DecoratorPipeline pipeline, TrialCall<T, R> call) throws Exception {
        TimeoutPolicy timeout = registration.timeoutPolicy();
        if (timeout == null) {
            return invokeTrial(context, pipeline, call);
        }
        return services.timeoutEnforcer().call(context, timeout.timeout(), () -> invokeTrial(context, pipeline, call));
    }

    private <R> R invokeTrial(InvocationContext context, DecoratorPipeline pipeline, TrialCall<T, R> call) throws Exception {
        Object value = pipeline.execute(context, () -> {
            Object resolved = services.resolver().resolve(registration.serviceType(), context.trialKey());
            return call.call(registration.serviceType().cast(resolved));
        });
        // decorators pass the trial's result through untyped
        @SuppressWarnings("unchecked")
        R result = (R) value;
        return result;
    }

    private String selectorName(Optional<SelectionModeProvider> provider) {
        String explicit = registration.selectorName();
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return provider
                .map(p -> p.defaultSelectorName(registration.serviceType(), services.namingConvention()))
                .orElseGet(() -> services.namingConvention().featureFlagNameFor(registration.serviceType()));
    }

    /**
     * Waits for the provider's answer. Anything other than a non-blank key prefers the default key.
     */
    private String selectPreferredKey(
            Optional<SelectionModeProvider> provider,
            String selectorName,
            String methodName,
            List<Object> arguments
    ) throws InterruptedException {
        String defaultKey = registration.defaultKey();
        if (provider.isEmpty()) {
            log.debug("No selection provider for mode={} experiment={}, using default key",
                    registration.modeIdentifier(), registration.experimentName());
            return defaultKey;
        }

        SelectionContext context = new SelectionContext(
                registration.serviceType(),
                selectorName,
                defaultKey,
                registration.trialKeys(),
                new SelectionContext.CallScope(methodName, arguments)
        );
        try {
            CompletableFuture<Optional<String>> future = provider.get().selectTrialKey(context);
            Optional<String> selected = future == null ? null : future.get();
            if (selected == null || selected.isEmpty() || selected.get().isBlank()) {
                return defaultKey;
            }
            return selected.get();
        } catch (ExecutionException e) {
            log.warn("Selection failed experiment={} mode={}, using default key: {}",
                    registration.experimentName(), registration.modeIdentifier(), String.valueOf(e.getCause()));
            return defaultKey;
        } catch (RuntimeException e) {
            log.warn("Selection failed experiment={} mode={}, using default key: {}",
                    registration.experimentName(), registration.modeIdentifier(), e.toString());
            return defaultKey;
        }
    }

    private void audit(AuditEventType type, String trialKey, Map<String, Object> details) {
        try {
            services.auditSink().record(AuditEvent.of(
                    type,
                    registration.experimentName(),
                    registration.serviceType(),
                    trialKey,
                    null,
                    details,
                    MDC.get(MDC_REQUEST_ID)
            ));
        } catch (RuntimeException e) {
            log.debug("Audit sink failed experiment={} type={}: {}", registration.experimentName(), type, e.toString());
        }
    }
}
