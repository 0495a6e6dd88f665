/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans one event out to every child sink in order. A failing child is logged and skipped; an
 * interrupted recording thread stops the fan-out and keeps its interrupt flag.
 */
public class CompositeAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeAuditSink.class);

    private final List<AuditSink> sinks;

    public CompositeAuditSink(List<AuditSink> sinks) {
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
    }

    public int size() {
        return sinks.size();
    }

    @Override
    public void record(AuditEvent event) {
        for (AuditSink sink : sinks) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Audit fan-out interrupted eventId={}", event.eventId());
                return;
            }
            try {
                sink.record(event);
            } catch (RuntimeException e) {
                log.warn("Audit sink {} failed eventId={}: {}", sink.getClass().getSimpleName(), event.eventId(), e.toString());
            }
        }
    }
}
