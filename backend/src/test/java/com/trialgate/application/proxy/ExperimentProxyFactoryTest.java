/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.proxy;

import com.trialgate.application.registration.Registration;
import com.trialgate.application.routing.InvocationRouter;
import com.trialgate.application.routing.Quoter;
import com.trialgate.application.routing.RoutingServices;
import com.trialgate.application.routing.TrialImplementationRegistry;
import com.trialgate.application.selection.ConfigurationValueProvider;
import com.trialgate.application.selection.SelectionModeRegistry;
import com.trialgate.domain.model.SelectionMode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentProxyFactoryTest {
    private final IOException checked = new IOException("catalog offline");

    @Test
    void routesInterfaceCallsToSelectedTrial() throws Exception {
        Quoter quoter = ExperimentProxyFactory.create(Quoter.class, router("variant"));
        assertEquals("variant:sku-7", quoter.quote("sku-7"));
    }

    @Test
    void checkedExceptionOfTrialReachesCallerUnwrapped() {
        Quoter quoter = ExperimentProxyFactory.create(Quoter.class, router("broken"));
        IOException thrown = assertThrows(IOException.class, () -> quoter.quote("sku-7"));
        assertSame(checked, thrown);
    }

    @Test
    void objectMethodsAreAnsweredByProxy() {
        Quoter first = ExperimentProxyFactory.create(Quoter.class, router("variant"));
        Quoter second = ExperimentProxyFactory.create(Quoter.class, router("variant"));

        assertEquals(first, first);
        assertNotEquals(first, second);
        assertEquals(System.identityHashCode(first), first.hashCode());
        assertTrue(first.toString().contains(Quoter.class.getName()));
    }

    @Test
    void rejectsConcreteClasses() {
        assertThrows(IllegalArgumentException.class, () -> ExperimentProxyFactory.create(String.class, () -> null));
    }

    private InvocationRouter<Quoter> router(String selectedKey) {
        TrialImplementationRegistry implementations = new TrialImplementationRegistry()
                .register(Quoter.class, "control", sku -> "control:" + sku)
                .register(Quoter.class, "variant", sku -> "variant:" + sku)
                .register(Quoter.class, "broken", sku -> {
                    throw checked;
                });
        Registration<Quoter> registration = Registration.builder(Quoter.class)
                .defaultTrial("control", Quoter.class)
                .trial("variant", Quoter.class)
                .trial("broken", Quoter.class)
                .selection(SelectionMode.CONFIGURATION_VALUE, "experiments.quoter")
                .build();
        SelectionModeRegistry modes = new SelectionModeRegistry(List.of(
                new ConfigurationValueProvider(key -> Optional.of(selectedKey))
        ));
        return new InvocationRouter<>(registration, RoutingServices.of(implementations, modes));
    }
}
