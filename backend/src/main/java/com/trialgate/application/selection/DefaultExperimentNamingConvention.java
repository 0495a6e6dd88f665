/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.selection;

import java.util.Locale;

/**
 * Flag name = simple type name, configuration key = {@code experiments.<SimpleName>},
 * kebab-case name drops an interface-style leading {@code I} ({@code IMyService -> my-service}).
 */
public class DefaultExperimentNamingConvention implements ExperimentNamingConvention {
    public static final String CONFIGURATION_PREFIX = "experiments.";

    @Override
    public String featureFlagNameFor(Class<?> serviceType) {
        return serviceType.getSimpleName();
    }

    @Override
    public String variantFlagNameFor(Class<?> serviceType) {
        return serviceType.getSimpleName();
    }

    @Override
    public String configurationKeyFor(Class<?> serviceType) {
        return CONFIGURATION_PREFIX + serviceType.getSimpleName();
    }

    @Override
    public String kebabCaseNameFor(Class<?> serviceType) {
        return toKebabCase(serviceType.getSimpleName());
    }

    static String toKebabCase(String name) {
        if (name.length() > 1 && name.charAt(0) == 'I' && Character.isUpperCase(name.charAt(1))) {
            name = name.substring(1);
        }
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (sb.length() > 0) {
                    boolean prevLower = Character.isLowerCase(name.charAt(i - 1));
                    boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                    if (prevLower || nextLower) {
                        sb.append('-');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
