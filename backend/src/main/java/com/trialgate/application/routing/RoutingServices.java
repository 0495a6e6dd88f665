/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import com.trialgate.application.activation.ActivationEvaluator;
import com.trialgate.application.audit.AuditSink;
import com.trialgate.application.resilience.TimeoutEnforcer;
import com.trialgate.application.selection.DefaultExperimentNamingConvention;
import com.trialgate.application.selection.ExperimentNamingConvention;
import com.trialgate.application.selection.SelectionModeRegistry;
import com.trialgate.application.telemetry.ExperimentTelemetry;
import com.trialgate.application.telemetry.NoopExperimentTelemetry;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Collaborators shared by every router of a process.
 */
public record RoutingServices(
        ImplementationResolver resolver,
        SelectionModeRegistry selectionModes,
        ExperimentNamingConvention namingConvention,
        ActivationEvaluator activation,
        ExperimentTelemetry telemetry,
        AuditSink auditSink,
        TimeoutEnforcer timeoutEnforcer
) {
    public RoutingServices {
        Objects.requireNonNull(resolver, "resolver");
        selectionModes = selectionModes == null ? new SelectionModeRegistry(List.of()) : selectionModes;
        namingConvention = namingConvention == null ? new DefaultExperimentNamingConvention() : namingConvention;
        activation = activation == null ? new ActivationEvaluator(Clock.systemUTC()) : activation;
        telemetry = telemetry == null ? NoopExperimentTelemetry.INSTANCE : telemetry;
        auditSink = auditSink == null ? event -> {} : auditSink;
        timeoutEnforcer = timeoutEnforcer == null ? TimeoutEnforcer.withDaemonThreads() : timeoutEnforcer;
    }

    public static RoutingServices of(ImplementationResolver resolver, SelectionModeRegistry selectionModes) {
        return new RoutingServices(resolver, selectionModes, null, null, null, null, null);
    }

    public RoutingServices withTelemetry(ExperimentTelemetry telemetry) {
        return new RoutingServices(resolver, selectionModes, namingConvention, activation, telemetry, auditSink, timeoutEnforcer);
    }

    public RoutingServices withAuditSink(AuditSink auditSink) {
        return new RoutingServices(resolver, selectionModes, namingConvention, activation, telemetry, auditSink, timeoutEnforcer);
    }

    public RoutingServices withActivation(ActivationEvaluator activation) {
        return new RoutingServices(resolver, selectionModes, namingConvention, activation, telemetry, auditSink, timeoutEnforcer);
    }
}
