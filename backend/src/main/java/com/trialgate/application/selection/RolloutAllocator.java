/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import com.trialgate.application.routing.StickyTrialRouter;

public final class RolloutAllocator {
    public static final int BUCKETS = 100;

    private RolloutAllocator() {}

    public static int bucketOf(String identity, String rolloutName, String seed) {
        String input = (seed == null ? "" : seed) + ":" + rolloutName + ":" + identity;
        return (int) Math.floorMod(StickyTrialRouter.fnv1a64(input), (long) BUCKETS);
    }

    public static boolean isIncluded(String identity, String rolloutName, int percentage, String seed) {
        if (percentage <= 0) return false;
        if (percentage >= BUCKETS) return true;
        return bucketOf(identity, rolloutName, seed) < percentage;
    }
}
