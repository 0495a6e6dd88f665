/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import com.trialgate.application.decorator.InvocationContext;
import com.trialgate.application.errors.TrialTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Races an attempt against a deadline. The attempt runs on a worker thread; on expiry the
 * attempt is marked abandoned, the worker is interrupted and whatever it later produces is
 * dropped. An attempt whose decorators already settled it at the deadline keeps its outcome.
 */
public class TimeoutEnforcer {
    private static final Logger log = LoggerFactory.getLogger(TimeoutEnforcer.class);

    private final ExecutorService executor;

    public TimeoutEnforcer(ExecutorService executor) {
        this.executor = executor;
    }

    public static TimeoutEnforcer withDaemonThreads() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("trialgate-timeout-");
        threadFactory.setDaemon(true);
        return new TimeoutEnforcer(Executors.newCachedThreadPool(threadFactory));
    }

    public <R> R call(InvocationContext context, Duration timeout, Callable<R> task) throws Exception {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<R> future = executor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!context.attempt().abandon()) {
                log.debug("Trial settled at its deadline service={} trial={}, keeping its outcome",
                        context.serviceType().getSimpleName(), context.trialKey());
                return outcomeOf(future);
            }
            future.cancel(true);
            log.warn("Trial timeout service={} method={} trial={} timeoutMs={}",
                    context.serviceType().getSimpleName(), context.methodName(), context.trialKey(), timeout.toMillis());
            throw new TrialTimeoutException(context.serviceType(), context.trialKey(), context.methodName(), timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static <R> R outcomeOf(Future<R> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception ex) return ex;
        if (cause instanceof Error err) throw err;
        return e;
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
