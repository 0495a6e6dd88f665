/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.decorator;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Who owns the outcome of one attempt. The attempt either settles with its own result or is
 * abandoned at its deadline, whichever happens first. Decorators record an outcome only when
 * {@link #settle()} returns {@code true}, so a late completion after abandonment leaves no trace.
 */
public final class AttemptState {
    private static final int RUNNING = 0;
    private static final int SETTLED = 1;
    private static final int ABANDONED = 2;

    private final AtomicInteger state = new AtomicInteger(RUNNING);

    /**
     * @return {@code false} once the attempt has been abandoned
     */
    public boolean settle() {
        return state.compareAndSet(RUNNING, SETTLED) || state.get() == SETTLED;
    }

    /**
     * @return {@code false} when the attempt already settled and its outcome must be kept
     */
    public boolean abandon() {
        return state.compareAndSet(RUNNING, ABANDONED) || state.get() == ABANDONED;
    }

    public boolean isAbandoned() {
        return state.get() == ABANDONED;
    }
}
