/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.support;

import org.springframework.stereotype.Component;

@Component("casualGreeting")
class CasualGreeting implements GreetingService {
    @Override
    public String greet(String name) {
        return "Hey " + name;
    }
}
