/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.infrastructure.identity;

import com.trialgate.application.selection.IdentityProvider;
import org.slf4j.MDC;

import java.util.Optional;

/**
 * Identity of the current request, as placed in the MDC by the subject identity filter.
 */
public class MdcIdentityProvider implements IdentityProvider {
    public static final String MDC_KEY = "subjectId";

    @Override
    public Optional<String> currentIdentity() {
        String id = MDC.get(MDC_KEY);
        return (id == null || id.isBlank()) ? Optional.empty() : Optional.of(id);
    }
}
