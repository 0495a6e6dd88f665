/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.proxy;

import com.trialgate.application.routing.InvocationRouter;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Builds a JDK dynamic proxy of a service interface whose methods are routed through an
 * {@link InvocationRouter}. {@code equals}, {@code hashCode} and {@code toString} are answered by
 * the proxy itself.
 */
public final class ExperimentProxyFactory {

    private ExperimentProxyFactory() {}

    public static <T> T create(Class<T> serviceType, InvocationRouter<T> router) {
        return create(serviceType, () -> router);
    }

    /**
     * The supplier is asked for a router on every call, so the proxy can follow registrations that
     * take turns over time.
     */
    public static <T> T create(Class<T> serviceType, Supplier<InvocationRouter<T>> routers) {
        if (!serviceType.isInterface()) {
            throw new IllegalArgumentException("Only interfaces can be proxied: " + serviceType.getName());
        }
        InvocationHandler handler = new RoutingHandler<>(serviceType, routers);
        Object proxy = Proxy.newProxyInstance(serviceType.getClassLoader(), new Class<?>[]{serviceType}, handler);
        return serviceType.cast(proxy);
    }

    private static final class RoutingHandler<T> implements InvocationHandler {
        private final Class<T> serviceType;
        private final Supplier<InvocationRouter<T>> routers;

        RoutingHandler(Class<T> serviceType, Supplier<InvocationRouter<T>> routers) {
            this.serviceType = serviceType;
            this.routers = routers;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return switch (method.getName()) {
                    case "equals" -> proxy == args[0];
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "toString" -> "ExperimentProxy[" + serviceType.getName() + "]";
                    default -> throw new UnsupportedOperationException(method.getName());
                };
            }

            List<Object> arguments = args == null ? List.of() : Arrays.asList(args);
            return routers.get().invoke(method.getName(), arguments, impl -> {
                try {
                    return method.invoke(impl, args);
                } catch (InvocationTargetException e) {
                    Throwable target = e.getTargetException();
                    if (target instanceof Exception ex) throw ex;
                    if (target instanceof Error err) throw err;
                    throw e;
                }
            });
        }
    }
}
