/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import com.trialgate.application.activation.ActivationEvaluator;
import com.trialgate.application.audit.AuditEvent;
import com.trialgate.application.audit.AuditEventType;
import com.trialgate.application.decorator.MetricsDecoratorFactory;
import com.trialgate.application.errors.CircuitOpenException;
import com.trialgate.application.errors.ExperimentDisabledException;
import com.trialgate.application.errors.TrialDisabledException;
import com.trialgate.application.errors.TrialTimeoutException;
import com.trialgate.application.metrics.MicrometerExperimentMetrics;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.InMemoryKillSwitchProvider;
import com.trialgate.application.resilience.TrialCircuitBreaker;
import com.trialgate.application.selection.SelectionModeRegistry;
import com.trialgate.application.telemetry.ExperimentTelemetry;
import com.trialgate.application.telemetry.TelemetryScope;
import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.CircuitState;
import com.trialgate.domain.model.ErrorPolicy;
import com.trialgate.domain.model.FallbackAction;
import com.trialgate.domain.model.TimeoutPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvocationRouterTest {
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final TrialImplementationRegistry implementations = new TrialImplementationRegistry();
    private final InMemoryKillSwitchProvider killSwitch = new InMemoryKillSwitchProvider();

    @Test
    void throwPolicySurfacesFirstFailureWithoutTryingOtherTrials() {
        IllegalStateException boom = new IllegalStateException("b down");
        working("a");
        failing("b", boom);

        InvocationRouter<Quoter> router = router(base().errorPolicy(ErrorPolicy.throwing()), "b");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> quote(router));
        assertSame(boom, thrown);
        assertEquals(List.of("b"), calls);
    }

    @Test
    void redirectDefaultFallsBackToDefaultTrial() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        RecordingTelemetry telemetry = new RecordingTelemetry();

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().errorPolicy(ErrorPolicy.redirectDefault()).build(),
                services("b").withTelemetry(telemetry)
        );

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("b", "a"), calls);
        assertEquals(List.of("start:b", "variant:b", "fallback:a", "success", "close"), telemetry.events);
    }

    @Test
    void redirectOrderedWalksFallbacksInOrderAndSurfacesLastError() {
        failing("a", new IllegalStateException("a down"));
        IllegalStateException last = new IllegalStateException("b down");
        failing("b", last);
        failing("c", new IllegalStateException("c down"));

        InvocationRouter<Quoter> router = router(base()
                .trial("c", Quoter.class)
                .errorPolicy(ErrorPolicy.redirectOrdered(List.of("a", "b"))), "c");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> quote(router));
        assertSame(last, thrown);
        assertEquals(List.of("c", "a", "b"), calls);
    }

    @Test
    void redirectSpecificUsesConfiguredFallback() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        working("c");

        InvocationRouter<Quoter> router = router(base()
                .trial("c", Quoter.class)
                .errorPolicy(ErrorPolicy.redirectSpecific("c")), "b");

        assertEquals("c:sku-1", quote(router));
        assertEquals(List.of("b", "c"), calls);
    }

    @Test
    void disabledExperimentFailsEveryCallBeforeSelection() {
        working("a");
        working("b");
        killSwitch.disableExperiment(Quoter.class);

        InvocationRouter<Quoter> router = router(base().errorPolicy(ErrorPolicy.redirectAny()), "b");

        ExperimentDisabledException e = assertThrows(ExperimentDisabledException.class, () -> quote(router));
        assertEquals(Quoter.class, e.getServiceType());
        assertTrue(calls.isEmpty());
    }

    @Test
    void disabledPreferredTrialFallsBackPerErrorPolicy() throws Exception {
        working("a");
        working("b");
        killSwitch.disableTrial(Quoter.class, "b");

        InvocationRouter<Quoter> router = router(base().errorPolicy(ErrorPolicy.redirectDefault()), "b");

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("a"), calls);
    }

    @Test
    void disabledPreferredTrialWithThrowPolicySurfacesTrialDisabled() {
        working("a");
        working("b");
        killSwitch.disableTrial(Quoter.class, "b");

        InvocationRouter<Quoter> router = router(base().errorPolicy(ErrorPolicy.throwing()), "b");

        TrialDisabledException e = assertThrows(TrialDisabledException.class, () -> quote(router));
        assertEquals("b", e.getTrialKey());
        assertTrue(calls.isEmpty());
    }

    @Test
    void inactiveExperimentGoesStraightToDefaultTrial() throws Exception {
        working("a");
        working("b");
        RecordingTelemetry telemetry = new RecordingTelemetry();
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().activeUntil(Instant.parse("2025-01-01T00:00:00Z")).build(),
                services("b").withTelemetry(telemetry).withActivation(new ActivationEvaluator(clock))
        );

        assertEquals("a:sku-1", quote(router));
        assertTrue(telemetry.events.isEmpty());
    }

    @Test
    void failedSelectionPrefersDefaultKey() throws Exception {
        working("a");
        working("b");
        SelectionModeRegistry modes = new SelectionModeRegistry(List.of(new FixedSelectionProvider(
                ctx -> CompletableFuture.failedFuture(new IllegalStateException("flag store down")))));

        InvocationRouter<Quoter> router = new InvocationRouter<>(base().build(), RoutingServices.of(implementations, modes));

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("a"), calls);
    }

    @Test
    void missingSelectionProviderPrefersDefaultKey() throws Exception {
        working("a");
        working("b");

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().build(),
                RoutingServices.of(implementations, new SelectionModeRegistry(List.of()))
        );

        assertEquals("a:sku-1", quote(router));
    }

    @Test
    void unknownSelectedKeyIsServedByDefaultImplementation() throws Exception {
        working("a");
        working("b");

        InvocationRouter<Quoter> router = router(base(), "stale-key");

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("a"), calls);
    }

    @Test
    void timeoutInThrowModeIsHandledByErrorPolicy() throws Exception {
        working("a");
        sleeping("b", 2_000);

        InvocationRouter<Quoter> router = router(base()
                .errorPolicy(ErrorPolicy.redirectDefault())
                .timeout(TimeoutPolicy.throwAfter(Duration.ofMillis(100))), "b");

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("b", "a"), calls);
    }

    @Test
    void timeoutInThrowModeWithThrowPolicyReachesCaller() {
        working("a");
        sleeping("b", 2_000);

        InvocationRouter<Quoter> router = router(base()
                .errorPolicy(ErrorPolicy.throwing())
                .timeout(TimeoutPolicy.throwAfter(Duration.ofMillis(100))), "b");

        TrialTimeoutException e = assertThrows(TrialTimeoutException.class, () -> quote(router));
        assertEquals("b", e.getTrialKey());
        assertEquals(Duration.ofMillis(100), e.getTimeout());
    }

    @Test
    void timeoutFallbackToDefaultShortCircuitsTheCascade() throws Exception {
        working("a");
        sleeping("b", 2_000);
        working("c");

        InvocationRouter<Quoter> router = router(base()
                .trial("c", Quoter.class)
                .errorPolicy(ErrorPolicy.redirectSpecific("c"))
                .timeout(TimeoutPolicy.fallbackToDefaultAfter(Duration.ofMillis(100))), "b");

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("b", "a"), calls);
    }

    @Test
    void lateCompletionOfTimedOutTrialLeavesNoOutcomeMetrics() throws Exception {
        working("a");
        implementations.register(Quoter.class, "b", sku -> {
            calls.add("b");
            long end = System.nanoTime() + Duration.ofMillis(400).toNanos();
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
            return "b:" + sku;
        });
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CountDownLatch finished = new CountDownLatch(1);

        InvocationRouter<Quoter> router = router(base()
                .errorPolicy(ErrorPolicy.throwing())
                .timeout(TimeoutPolicy.throwAfter(Duration.ofMillis(100)))
                .decorator(() -> (ctx, next) -> {
                    try {
                        return next.proceed();
                    } finally {
                        finished.countDown();
                    }
                })
                .decorator(new MetricsDecoratorFactory(new MicrometerExperimentMetrics(registry))), "b");

        assertThrows(TrialTimeoutException.class, () -> quote(router));
        assertTrue(finished.await(5, TimeUnit.SECONDS));

        assertEquals(1.0, registry.get(MetricsDecoratorFactory.INVOCATIONS).tag("trial_key", "b").counter().count());
        assertNull(registry.find(MetricsDecoratorFactory.SUCCESSES).tag("trial_key", "b").counter());
        assertNull(registry.find(MetricsDecoratorFactory.ERRORS).tag("trial_key", "b").counter());
        assertNull(registry.find(MetricsDecoratorFactory.DURATION).tag("trial_key", "b").summary());
    }

    @Test
    void timeoutExceptionThrownByTrialIsAnOrdinaryFailure() {
        working("a");
        TrialTimeoutException own = new TrialTimeoutException(Quoter.class, "b", "quote", Duration.ofMillis(5), null);
        failing("b", own);

        InvocationRouter<Quoter> router = router(base()
                .errorPolicy(ErrorPolicy.throwing())
                .timeout(TimeoutPolicy.fallbackToDefaultAfter(Duration.ofSeconds(5))), "b");

        TrialTimeoutException thrown = assertThrows(TrialTimeoutException.class, () -> quote(router));
        assertSame(own, thrown);
        assertEquals(List.of("b"), calls);
    }

    @Test
    void unknownPreferredKeyAttemptsDefaultTrialOnce() {
        IllegalStateException boom = new IllegalStateException("a down");
        failing("a", boom);
        working("b");

        InvocationRouter<Quoter> router = router(base().errorPolicy(ErrorPolicy.redirectDefault()), "ghost");

        assertSame(boom, assertThrows(IllegalStateException.class, () -> quote(router)));
        assertEquals(List.of("a"), calls);
    }

    @Test
    void unknownPreferredKeyServedByDefaultIsNotAFallback() throws Exception {
        working("a");
        working("b");
        RecordingTelemetry telemetry = new RecordingTelemetry();

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().errorPolicy(ErrorPolicy.redirectDefault()).build(),
                services("ghost").withTelemetry(telemetry)
        );

        assertEquals("a:sku-1", quote(router));
        assertEquals(List.of("a"), calls);
        assertEquals(List.of("start:ghost", "variant:ghost", "success", "close"), telemetry.events);
    }

    @Test
    void concurrentFailuresOpenCircuitOnceAndRecordEveryAttempt() throws Exception {
        AtomicInteger invoked = new AtomicInteger();
        working("a");
        implementations.register(Quoter.class, "b", sku -> {
            invoked.incrementAndGet();
            throw new IllegalStateException("b down");
        });
        CircuitBreakerOptions options = new CircuitBreakerOptions(
                0.5, 5, Duration.ofSeconds(30), Duration.ofSeconds(30), FallbackAction.THROW_EXCEPTION, null);
        Registration<Quoter> registration = base().errorPolicy(ErrorPolicy.throwing()).circuitBreaker(options).build();
        TrialCircuitBreaker breaker = registration.circuitBreaker();
        List<String> transitions = new CopyOnWriteArrayList<>();
        breaker.onStateTransition((from, to) -> transitions.add(from + "->" + to));
        InvocationRouter<Quoter> router = new InvocationRouter<>(registration, services("b"));

        int callers = 48;
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(12);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        quote(router);
                    } catch (IllegalStateException e) {
                        failed.incrementAndGet();
                    } catch (CircuitOpenException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(callers, failed.get() + rejected.get());
        assertTrue(rejected.get() > 0);
        assertEquals(invoked.get(), failed.get());
        assertEquals(failed.get(), breaker.bufferedCalls());
        assertEquals(failed.get(), breaker.failedCalls());
        assertEquals(rejected.get(), breaker.notPermittedCalls());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
        assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    void circuitOpensAfterFailuresAndClosesAfterSuccessfulHalfOpenCall() throws Exception {
        working("a");
        AtomicBoolean healthy = new AtomicBoolean(false);
        implementations.register(Quoter.class, "b", sku -> {
            calls.add("b");
            if (!healthy.get()) throw new IllegalStateException("b down");
            return "b:" + sku;
        });
        CircuitBreakerOptions options = new CircuitBreakerOptions(
                0.5, 2, Duration.ofSeconds(10), Duration.ofMillis(200), FallbackAction.THROW_EXCEPTION, null);
        Registration<Quoter> registration = base().errorPolicy(ErrorPolicy.throwing()).circuitBreaker(options).build();
        InvocationRouter<Quoter> router = new InvocationRouter<>(registration, services("b"));

        assertThrows(IllegalStateException.class, () -> quote(router));
        assertThrows(IllegalStateException.class, () -> quote(router));
        assertEquals(CircuitState.OPEN, registration.circuitBreaker().state());

        assertThrows(CircuitOpenException.class, () -> quote(router));
        assertEquals(List.of("b", "b"), calls);

        Thread.sleep(300);
        healthy.set(true);
        assertEquals("b:sku-1", quote(router));
        assertEquals(CircuitState.CLOSED, registration.circuitBreaker().state());
    }

    @Test
    void openCircuitCanFallBackToSpecificTrial() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        working("c");
        CircuitBreakerOptions options = new CircuitBreakerOptions(
                0.5, 1, Duration.ofSeconds(10), Duration.ofSeconds(30), FallbackAction.FALLBACK_TO_SPECIFIC_TRIAL, "c");

        InvocationRouter<Quoter> router = router(base()
                .trial("c", Quoter.class)
                .errorPolicy(ErrorPolicy.throwing())
                .circuitBreaker(options), "b");

        assertThrows(IllegalStateException.class, () -> quote(router));
        assertEquals("c:sku-1", quote(router));
        assertEquals(List.of("b", "c"), calls);
    }

    @Test
    void failingTelemetryAndAuditDoNotChangeTheOutcome() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        ExperimentTelemetry broken = (type, method, selector, preferred, candidates) -> {
            throw new IllegalStateException("telemetry down");
        };

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().errorPolicy(ErrorPolicy.redirectDefault()).build(),
                services("b").withTelemetry(broken).withAuditSink(event -> {
                    throw new IllegalStateException("audit down");
                })
        );

        assertEquals("a:sku-1", quote(router));
    }

    @Test
    void auditRecordsSelectionAndFallback() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        List<AuditEvent> events = new CopyOnWriteArrayList<>();

        InvocationRouter<Quoter> router = new InvocationRouter<>(
                base().errorPolicy(ErrorPolicy.redirectDefault()).build(),
                services("b").withAuditSink(events::add)
        );
        quote(router);

        assertEquals(List.of(AuditEventType.VARIANT_SELECTED, AuditEventType.FALLBACK_TRIGGERED),
                events.stream().map(AuditEvent::eventType).toList());
        assertEquals("b", events.get(0).selectedTrialKey());
        assertEquals("a", events.get(1).selectedTrialKey());
    }

    @Test
    void decoratorsSeeTheTrialBeingAttempted() throws Exception {
        working("a");
        failing("b", new IllegalStateException("b down"));
        List<String> seen = new CopyOnWriteArrayList<>();

        InvocationRouter<Quoter> router = router(base()
                .errorPolicy(ErrorPolicy.redirectDefault())
                .decorator(() -> (ctx, next) -> {
                    seen.add(ctx.trialKey() + "/" + ctx.methodName() + "/" + ctx.arguments());
                    return next.proceed();
                }), "b");

        quote(router);
        assertEquals(List.of("b/quote/[sku-1]", "a/quote/[sku-1]"), seen);
    }

    @Test
    void implementationErrorsAreNotWrapped() {
        failing("a", new IllegalArgumentException("bad sku"));
        working("b");

        InvocationRouter<Quoter> router = router(base(), "a");

        Exception e = assertThrows(Exception.class, () -> quote(router));
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    private Registration.Builder<Quoter> base() {
        return Registration.builder(Quoter.class)
                .defaultTrial("a", Quoter.class)
                .trial("b", Quoter.class)
                .customSelection(FixedSelectionProvider.MODE, "quoter")
                .killSwitch(killSwitch);
    }

    private InvocationRouter<Quoter> router(Registration.Builder<Quoter> builder, String selectedKey) {
        return new InvocationRouter<>(builder.build(), services(selectedKey));
    }

    private RoutingServices services(String selectedKey) {
        return RoutingServices.of(implementations,
                new SelectionModeRegistry(List.of(FixedSelectionProvider.choosing(selectedKey))));
    }

    private String quote(InvocationRouter<Quoter> router) throws Exception {
        return router.invoke("quote", List.of("sku-1"), q -> q.quote("sku-1"));
    }

    private void working(String key) {
        implementations.register(Quoter.class, key, sku -> {
            calls.add(key);
            return key + ":" + sku;
        });
    }

    private void failing(String key, RuntimeException error) {
        implementations.register(Quoter.class, key, sku -> {
            calls.add(key);
            throw error;
        });
    }

    private void sleeping(String key, long millis) {
        implementations.register(Quoter.class, key, sku -> {
            calls.add(key);
            Thread.sleep(millis);
            return key + ":" + sku;
        });
    }

    private static final class RecordingTelemetry implements ExperimentTelemetry {
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public TelemetryScope startInvocation(Class<?> serviceType, String methodName, String selectorName,
                                              String preferredKey, List<String> candidateKeys) {
            events.add("start:" + preferredKey);
            return new TelemetryScope() {
                @Override
                public void recordSuccess() {
                    events.add("success");
                }

                @Override
                public void recordFailure(Throwable error) {
                    events.add("failure:" + error.getMessage());
                }

                @Override
                public void recordFallback(String usedKey) {
                    events.add("fallback:" + usedKey);
                }

                @Override
                public void recordVariant(String variant, String source) {
                    events.add("variant:" + variant);
                }

                @Override
                public void close() {
                    events.add("close");
                }
            };
        }
    }
}
