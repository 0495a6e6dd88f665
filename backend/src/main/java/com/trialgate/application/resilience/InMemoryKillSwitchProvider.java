/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local kill switch. Reads never block; concurrent writes are last-write-wins.
 */
public class InMemoryKillSwitchProvider implements KillSwitchProvider {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKillSwitchProvider.class);
    private static final String SEPARATOR = "::";

    private final Set<String> disabledExperiments = ConcurrentHashMap.newKeySet();
    private final Set<String> disabledTrials = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isExperimentDisabled(Class<?> serviceType) {
        return disabledExperiments.contains(experimentKey(serviceType));
    }

    @Override
    public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
        return disabledTrials.contains(trialKey(serviceType, trialKey));
    }

    @Override
    public void disableExperiment(Class<?> serviceType) {
        if (disabledExperiments.add(experimentKey(serviceType))) {
            log.warn("Kill switch engaged experiment={}", serviceType.getName());
        }
    }

    @Override
    public void enableExperiment(Class<?> serviceType) {
        if (disabledExperiments.remove(experimentKey(serviceType))) {
            log.info("Kill switch released experiment={}", serviceType.getName());
        }
    }

    @Override
    public void disableTrial(Class<?> serviceType, String trialKey) {
        if (disabledTrials.add(trialKey(serviceType, trialKey))) {
            log.warn("Kill switch engaged experiment={} trial={}", serviceType.getName(), trialKey);
        }
    }

    @Override
    public void enableTrial(Class<?> serviceType, String trialKey) {
        if (disabledTrials.remove(trialKey(serviceType, trialKey))) {
            log.info("Kill switch released experiment={} trial={}", serviceType.getName(), trialKey);
        }
    }

    @Override
    public Set<String> disabledTrials(Class<?> serviceType) {
        String prefix = experimentKey(serviceType) + SEPARATOR;
        Set<String> keys = new TreeSet<>();
        for (String entry : disabledTrials) {
            if (entry.startsWith(prefix)) {
                keys.add(entry.substring(prefix.length()));
            }
        }
        return keys;
    }

    private static String experimentKey(Class<?> serviceType) {
        return serviceType.getName();
    }

    private static String trialKey(Class<?> serviceType, String trialKey) {
        return serviceType.getName() + SEPARATOR + trialKey;
    }
}
