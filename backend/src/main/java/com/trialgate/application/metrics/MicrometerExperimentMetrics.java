/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ExperimentMetrics} on top of a Micrometer registry. Meters are cached by name and tag
 * set so the hot path does not go through registry lookups.
 */
public final class MicrometerExperimentMetrics implements ExperimentMetrics {

    private final MeterRegistry registry;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> histograms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

    public MicrometerExperimentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name, Map<String, String> tags) {
        Tags t = toTags(tags);
        counters.computeIfAbsent(cacheKey(name, t),
                k -> Counter.builder(name).tags(t).register(registry)).increment();
    }

    @Override
    public void recordHistogram(String name, double value, Map<String, String> tags) {
        Tags t = toTags(tags);
        histograms.computeIfAbsent(cacheKey(name, t),
                k -> DistributionSummary.builder(name).tags(t).publishPercentileHistogram().register(registry))
                .record(value);
    }

    @Override
    public void setGauge(String name, double value, Map<String, String> tags) {
        Tags t = toTags(tags);
        gauges.computeIfAbsent(cacheKey(name, t), k -> {
            AtomicReference<Double> holder = new AtomicReference<>(0.0);
            Gauge.builder(name, holder, AtomicReference::get).tags(t).register(registry);
            return holder;
        }).set(value);
    }

    @Override
    public void recordSummary(String name, double value, Map<String, String> tags) {
        Tags t = toTags(tags);
        summaries.computeIfAbsent(cacheKey(name, t),
                k -> DistributionSummary.builder(name).tags(t).register(registry))
                .record(value);
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        List<Tag> list = new ArrayList<>(tags.size());
        for (Map.Entry<String, String> e : new TreeMap<>(tags).entrySet()) {
            list.add(Tag.of(e.getKey(), safeTag(e.getValue())));
        }
        return Tags.of(list);
    }

    private static String cacheKey(String name, Tags tags) {
        StringBuilder sb = new StringBuilder(name);
        for (Tag tag : tags) {
            sb.append('|').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return sb.toString();
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String s = raw.trim();
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
