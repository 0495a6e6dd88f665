/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.routing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic identity-to-trial assignment. The identity is hashed together with the experiment
 * name, so one user can land on different trials in different experiments, and the result is
 * indexed into the sorted trial keys so map iteration order never changes an assignment.
 */
public final class StickyTrialRouter {
    private static final long FNV64_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV64_PRIME = 0x100000001b3L;

    private StickyTrialRouter() {}

    public static String selectTrial(String identity, String experimentName, Collection<String> trialKeys) {
        if (trialKeys == null || trialKeys.isEmpty()) {
            throw new IllegalArgumentException("Sticky routing for '" + experimentName + "' has no trial keys");
        }
        if (trialKeys.size() == 1) {
            return trialKeys.iterator().next();
        }
        List<String> sorted = new ArrayList<>(trialKeys);
        Collections.sort(sorted);

        long hash = fnv1a64(identity + "\u0001" + experimentName);
        int index = (int) Math.floorMod(hash, (long) sorted.size());
        return sorted.get(index);
    }

    public static long fnv1a64(String s) {
        long hash = FNV64_OFFSET;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV64_PRIME;
        }
        return hash;
    }
}
