/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.infrastructure.resolver;

import com.trialgate.application.registration.Registration;
import com.trialgate.application.routing.ImplementationResolver;
import com.trialgate.domain.model.TrialDescriptor;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves trials to Spring beans, by bean name when the trial descriptor has one and by
 * implementation type otherwise. Beans are looked up on every call so that prototype and scoped
 * beans behave as Spring defines them.
 */
public class SpringImplementationResolver implements ImplementationResolver {

    private final BeanFactory beanFactory;
    private final Map<Class<?>, Map<String, TrialDescriptor>> descriptors = new ConcurrentHashMap<>();

    public SpringImplementationResolver(BeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    public void register(Registration<?> registration) {
        Map<String, TrialDescriptor> byKey = descriptors.computeIfAbsent(registration.serviceType(), k -> new ConcurrentHashMap<>());
        for (TrialDescriptor descriptor : registration.trials().values()) {
            TrialDescriptor existing = byKey.putIfAbsent(descriptor.key(), descriptor);
            if (existing != null && !existing.equals(descriptor)) {
                throw new IllegalStateException(
                        "Trial '" + descriptor.key() + "' of " + registration.serviceType().getName()
                                + " is bound to two implementations: " + existing + " and " + descriptor
                );
            }
        }
    }

    @Override
    public Object resolve(Class<?> serviceType, String trialKey) {
        Map<String, TrialDescriptor> byKey = descriptors.get(serviceType);
        TrialDescriptor descriptor = byKey == null ? null : byKey.get(trialKey);
        if (descriptor == null) {
            throw new IllegalArgumentException("No trial '" + trialKey + "' registered for service=" + serviceType.getName());
        }

        Object bean;
        try {
            bean = descriptor.beanName() != null
                    ? beanFactory.getBean(descriptor.beanName())
                    : beanFactory.getBean(descriptor.implementationType());
        } catch (BeansException e) {
            throw new IllegalArgumentException(
                    "Cannot resolve trial '" + trialKey + "' of " + serviceType.getName() + ": " + e.getMessage(), e
            );
        }
        if (!serviceType.isInstance(bean)) {
            throw new IllegalArgumentException(
                    "Bean for trial '" + trialKey + "' is a " + bean.getClass().getName()
                            + ", not a " + serviceType.getName()
            );
        }
        return bean;
    }
}
