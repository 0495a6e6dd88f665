/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Optional;

/**
 * Identity of the subject (user, session, tenant) on whose behalf the current call runs.
 */
public interface IdentityProvider {
    Optional<String> currentIdentity();
}
