/*
 * PlannerConfiguration.java
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

package io.deltaplan.plan.planning;

import io.deltaplan.annotation.API;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;

/**
 * A set of configuration options for plan construction and the {@link DeltaQueryPlanner}.
 */
@API(API.Status.STABLE)
public class PlannerConfiguration {
    /**
     * Default limit on the number of nodes one construction request may create.
     */
    public static final int DEFAULT_COMPLEXITY_THRESHOLD = 10000;

    @Nonnull
    private static final PlannerConfiguration DEFAULT_PLANNER_CONFIGURATION = builder().build();

    private final boolean planJoins;
    private final boolean preferArrangedInputs;
    private final int complexityThreshold;

    private PlannerConfiguration(@Nonnull PlannerConfiguration.Builder builder) {
        this.planJoins = builder.planJoins;
        this.preferArrangedInputs = builder.preferArrangedInputs;
        this.complexityThreshold = builder.complexityThreshold;
    }

    /**
     * Get whether joins without an explicit implementation are planned as delta queries. If not, they are left
     * unplanned.
     * @return whether joins are planned
     */
    public boolean shouldPlanJoins() {
        return planJoins;
    }

    /**
     * Get whether the planner, when choosing the next input to probe, prefers an input that is already arranged
     * by the key it would be probed with.
     * @return whether already-arranged inputs are preferred
     */
    public boolean shouldPreferArrangedInputs() {
        return preferArrangedInputs;
    }

    /**
     * Get the maximum number of nodes a single construction request may create before it is rejected with a
     * {@link io.deltaplan.PlanComplexityException}.
     * @return the complexity threshold
     */
    public int getComplexityThreshold() {
        return complexityThreshold;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static PlannerConfiguration defaultPlannerConfiguration() {
        return DEFAULT_PLANNER_CONFIGURATION;
    }

    @Override
    public String toString() {
        return "PlannerConfiguration{planJoins=" + planJoins
               + ", preferArrangedInputs=" + preferArrangedInputs
               + ", complexityThreshold=" + complexityThreshold + "}";
    }

    /**
     * A builder for {@link PlannerConfiguration}.
     */
    public static class Builder {
        private boolean planJoins = true;
        private boolean preferArrangedInputs = true;
        private int complexityThreshold = DEFAULT_COMPLEXITY_THRESHOLD;

        public Builder(@Nonnull PlannerConfiguration configuration) {
            this.planJoins = configuration.planJoins;
            this.preferArrangedInputs = configuration.preferArrangedInputs;
            this.complexityThreshold = configuration.complexityThreshold;
        }

        public Builder() {
        }

        @Nonnull
        public Builder setPlanJoins(boolean planJoins) {
            this.planJoins = planJoins;
            return this;
        }

        @Nonnull
        public Builder setPreferArrangedInputs(boolean preferArrangedInputs) {
            this.preferArrangedInputs = preferArrangedInputs;
            return this;
        }

        @Nonnull
        public Builder setComplexityThreshold(int complexityThreshold) {
            Preconditions.checkArgument(complexityThreshold > 0, "complexity threshold must be positive");
            this.complexityThreshold = complexityThreshold;
            return this;
        }

        @Nonnull
        public PlannerConfiguration build() {
            return new PlannerConfiguration(this);
        }
    }
}
