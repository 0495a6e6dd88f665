/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TrialgateApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrialgateApplication.class, args);
    }
}
