/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorators of one call, nested so that the first factory's decorator is the outermost.
 */
public final class DecoratorPipeline {
    private static final DecoratorPipeline EMPTY = new DecoratorPipeline(List.of());

    private final List<ExperimentDecorator> decorators;

    private DecoratorPipeline(List<ExperimentDecorator> decorators) {
        this.decorators = decorators;
    }

    public static DecoratorPipeline build(List<ExperimentDecoratorFactory> factories) {
        if (factories == null || factories.isEmpty()) {
            return EMPTY;
        }
        List<ExperimentDecorator> decorators = new ArrayList<>(factories.size());
        for (ExperimentDecoratorFactory factory : factories) {
            ExperimentDecorator decorator = factory.create();
            if (decorator == null) {
                throw new IllegalStateException("Decorator factory " + factory.getClass().getName() + " returned null");
            }
            decorators.add(decorator);
        }
        return new DecoratorPipeline(List.copyOf(decorators));
    }

    public int size() {
        return decorators.size();
    }

    public Object execute(InvocationContext context, ExperimentDecorator.Next terminal) throws Exception {
        return step(0, context, terminal);
    }

    private Object step(int index, InvocationContext context, ExperimentDecorator.Next terminal) throws Exception {
        if (index == decorators.size()) {
            return terminal.proceed();
        }
        return decorators.get(index).invoke(context, () -> step(index + 1, context, terminal));
    }
}
