/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialgate.application.ExperimentRegistry;
import com.trialgate.application.activation.ActivationEvaluator;
import com.trialgate.application.audit.AuditSink;
import com.trialgate.application.audit.CompositeAuditSink;
import com.trialgate.application.audit.LoggingAuditSink;
import com.trialgate.application.metrics.ExperimentMetrics;
import com.trialgate.application.metrics.MicrometerExperimentMetrics;
import com.trialgate.application.metrics.NoopExperimentMetrics;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.InMemoryKillSwitchProvider;
import com.trialgate.application.resilience.KillSwitchProvider;
import com.trialgate.application.resilience.TimeoutEnforcer;
import com.trialgate.application.routing.RoutingServices;
import com.trialgate.application.selection.BooleanFeatureFlagProvider;
import com.trialgate.application.selection.ConfigurationSource;
import com.trialgate.application.selection.ConfigurationValueProvider;
import com.trialgate.application.selection.DefaultExperimentNamingConvention;
import com.trialgate.application.selection.ExperimentNamingConvention;
import com.trialgate.application.selection.FeatureFlagSource;
import com.trialgate.application.selection.IdentityProvider;
import com.trialgate.application.selection.RolloutOptions;
import com.trialgate.application.selection.RolloutProvider;
import com.trialgate.application.selection.SelectionModeProvider;
import com.trialgate.application.selection.SelectionModeRegistry;
import com.trialgate.application.selection.StagedRolloutOptions;
import com.trialgate.application.selection.StagedRolloutProvider;
import com.trialgate.application.selection.StickyRoutingProvider;
import com.trialgate.application.telemetry.ExperimentTelemetry;
import com.trialgate.application.telemetry.LoggingExperimentTelemetry;
import com.trialgate.application.validation.TrialConflictDetector;
import com.trialgate.infrastructure.environment.EnvironmentConfigurationSource;
import com.trialgate.infrastructure.environment.EnvironmentFeatureFlagSource;
import com.trialgate.infrastructure.identity.MdcIdentityProvider;
import com.trialgate.infrastructure.resolver.SpringImplementationResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class TrialgateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KillSwitchProvider killSwitchProvider() {
        return new InMemoryKillSwitchProvider();
    }

    @Bean
    public FeatureFlagSource featureFlagSource(Environment environment) {
        return new EnvironmentFeatureFlagSource(environment);
    }

    @Bean
    public ConfigurationSource configurationSource(Environment environment) {
        return new EnvironmentConfigurationSource(environment);
    }

    @Bean
    public IdentityProvider identityProvider() {
        return new MdcIdentityProvider();
    }

    @Bean
    public ExperimentNamingConvention experimentNamingConvention() {
        return new DefaultExperimentNamingConvention();
    }

    @Bean
    public BooleanFeatureFlagProvider booleanFeatureFlagProvider(FeatureFlagSource flags) {
        return new BooleanFeatureFlagProvider(flags);
    }

    @Bean
    public ConfigurationValueProvider configurationValueProvider(ConfigurationSource configuration) {
        return new ConfigurationValueProvider(configuration);
    }

    @Bean
    public StickyRoutingProvider stickyRoutingProvider(IdentityProvider identityProvider) {
        return new StickyRoutingProvider(identityProvider);
    }

    @Bean
    public RolloutProvider rolloutProvider(IdentityProvider identityProvider, TrialsProperties properties) {
        TrialsProperties.Rollout r = properties.rollout();
        RolloutOptions options = r == null
                ? RolloutOptions.defaults()
                : new RolloutOptions(r.percentage() == null ? 100 : r.percentage(), r.includedKey(), r.excludedKey(), r.seed());
        return new RolloutProvider(identityProvider, options);
    }

    @Bean
    public StagedRolloutProvider stagedRolloutProvider(IdentityProvider identityProvider, TrialsProperties properties, Clock clock) {
        TrialsProperties.StagedRollout r = properties.stagedRollout();
        if (r == null) {
            return new StagedRolloutProvider(identityProvider, null, clock);
        }
        List<StagedRolloutOptions.Stage> stages = new ArrayList<>();
        if (r.stages() != null) {
            for (TrialsProperties.Stage stage : r.stages()) {
                try {
                    stages.add(new StagedRolloutOptions.Stage(
                            Instant.parse(stage.startsAt().trim()),
                            stage.percentage() == null ? 0 : stage.percentage(),
                            stage.description()
                    ));
                } catch (DateTimeParseException e) {
                    throw new IllegalStateException("Staged rollout stage startsAt is not an ISO-8601 instant: " + stage.startsAt(), e);
                }
            }
        }
        return new StagedRolloutProvider(identityProvider,
                new StagedRolloutOptions(stages, r.includedKey(), r.excludedKey(), r.seed()), clock);
    }

    /**
     * Collects every {@link SelectionModeProvider} bean, so applications add custom modes by
     * declaring a bean.
     */
    @Bean
    public SelectionModeRegistry selectionModeRegistry(List<SelectionModeProvider> providers) {
        return new SelectionModeRegistry(providers);
    }

    @Bean
    public ExperimentTelemetry experimentTelemetry() {
        return new LoggingExperimentTelemetry();
    }

    @Bean
    public ExperimentMetrics experimentMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry == null ? NoopExperimentMetrics.INSTANCE : new MicrometerExperimentMetrics(registry);
    }

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new CompositeAuditSink(List.of(new LoggingAuditSink(objectMapper)));
    }

    @Bean(destroyMethod = "shutdown")
    public TimeoutEnforcer timeoutEnforcer() {
        return TimeoutEnforcer.withDaemonThreads();
    }

    @Bean
    public ActivationEvaluator activationEvaluator(Clock clock) {
        return new ActivationEvaluator(clock);
    }

    @Bean
    public TrialConflictDetector trialConflictDetector() {
        return new TrialConflictDetector();
    }

    @Bean
    public SpringImplementationResolver springImplementationResolver(BeanFactory beanFactory) {
        return new SpringImplementationResolver(beanFactory);
    }

    @Bean
    public ExperimentRegistrationLoader experimentRegistrationLoader(KillSwitchProvider killSwitch, ExperimentMetrics metrics) {
        return new ExperimentRegistrationLoader(TrialgateConfig.class.getClassLoader(), killSwitch, metrics);
    }

    /**
     * Loads the configured experiments and refuses to start when they conflict.
     */
    @Bean
    public ExperimentRegistry experimentRegistry(
            TrialsProperties properties,
            ExperimentRegistrationLoader loader,
            SpringImplementationResolver resolver,
            SelectionModeRegistry selectionModes,
            ExperimentNamingConvention namingConvention,
            ActivationEvaluator activation,
            ExperimentTelemetry telemetry,
            AuditSink auditSink,
            TimeoutEnforcer timeoutEnforcer,
            TrialConflictDetector conflictDetector
    ) {
        List<Registration<?>> registrations = loader.load(properties);
        RoutingServices services = new RoutingServices(
                resolver, selectionModes, namingConvention, activation, telemetry, auditSink, timeoutEnforcer
        );
        conflictDetector.validateOrThrow(registrations);
        registrations.forEach(resolver::register);
        return new ExperimentRegistry(registrations, services, conflictDetector);
    }
}
