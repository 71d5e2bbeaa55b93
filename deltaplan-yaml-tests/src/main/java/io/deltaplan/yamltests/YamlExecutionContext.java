/*
 * YamlExecutionContext.java
 *
 * This source file is part of the deltaplan open source project
 *
 * Copyright 2021-2024 the deltaplan project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.deltaplan.yamltests;

import io.deltaplan.plan.planning.PlannerConfiguration;

import javax.annotation.Nonnull;

/**
 * State shared by the blocks of one YAML file: where the file came from and the planner configuration that the
 * most recent {@code config} block left in effect.
 */
public final class YamlExecutionContext {
    @Nonnull
    private final String resourcePath;
    @Nonnull
    private PlannerConfiguration plannerConfiguration;

    YamlExecutionContext(@Nonnull String resourcePath, @Nonnull PlannerConfiguration plannerConfiguration) {
        this.resourcePath = resourcePath;
        this.plannerConfiguration = plannerConfiguration;
    }

    @Nonnull
    public String getResourcePath() {
        return resourcePath;
    }

    @Nonnull
    public PlannerConfiguration getPlannerConfiguration() {
        return plannerConfiguration;
    }

    void setPlannerConfiguration(@Nonnull PlannerConfiguration plannerConfiguration) {
        this.plannerConfiguration = plannerConfiguration;
    }
}
