/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.api.admin;

import com.trialgate.api.ApiException;
import com.trialgate.application.ExperimentRegistry;
import com.trialgate.application.ExperimentStatus;
import com.trialgate.application.validation.TrialConflict;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/experiments")
public class ExperimentAdminController {
    static final String ACTOR_HEADER = "X-Admin-Actor";

    private final ExperimentRegistry experimentRegistry;

    public ExperimentAdminController(ExperimentRegistry experimentRegistry) {
        this.experimentRegistry = experimentRegistry;
    }

    @GetMapping
    public List<ExperimentStatus> list() {
        return experimentRegistry.statuses();
    }

    @GetMapping("/conflicts")
    public List<ConflictView> conflicts() {
        return experimentRegistry.conflicts().stream().map(ConflictView::of).toList();
    }

    @GetMapping("/{name}")
    public ExperimentStatus get(@PathVariable("name") String name) {
        requireExperiment(name);
        return experimentRegistry.status(name);
    }

    @PostMapping("/{name}/disable")
    public ExperimentStatus disable(
            @PathVariable("name") String name,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor
    ) {
        requireExperiment(name);
        return experimentRegistry.disableExperiment(name, actor);
    }

    @PostMapping("/{name}/enable")
    public ExperimentStatus enable(
            @PathVariable("name") String name,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor
    ) {
        requireExperiment(name);
        return experimentRegistry.enableExperiment(name, actor);
    }

    @PostMapping("/{name}/trials/{key}/disable")
    public ExperimentStatus disableTrial(
            @PathVariable("name") String name,
            @PathVariable("key") String key,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor
    ) {
        requireExperiment(name);
        return experimentRegistry.disableTrial(name, key, actor);
    }

    @PostMapping("/{name}/trials/{key}/enable")
    public ExperimentStatus enableTrial(
            @PathVariable("name") String name,
            @PathVariable("key") String key,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor
    ) {
        requireExperiment(name);
        return experimentRegistry.enableTrial(name, key, actor);
    }

    private void requireExperiment(String name) {
        if (experimentRegistry.find(name).isEmpty()) {
            throw new ApiException(HttpStatus.NOT_FOUND, "Experiment not found: " + name);
        }
    }

    public record ConflictView(String type, String serviceType, String description, List<String> experimentNames) {
        static ConflictView of(TrialConflict conflict) {
            return new ConflictView(
                    conflict.type().name(),
                    conflict.serviceType().getName(),
                    conflict.description(),
                    conflict.experimentNames()
            );
        }
    }
}
