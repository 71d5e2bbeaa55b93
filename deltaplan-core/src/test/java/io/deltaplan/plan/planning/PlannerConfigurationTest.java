/*
 * PlannerConfigurationTest.java
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PlannerConfiguration}.
 */
public class PlannerConfigurationTest {
    @Test
    void defaults() {
        final PlannerConfiguration configuration = PlannerConfiguration.defaultPlannerConfiguration();
        assertTrue(configuration.shouldPlanJoins());
        assertTrue(configuration.shouldPreferArrangedInputs());
        assertEquals(PlannerConfiguration.DEFAULT_COMPLEXITY_THRESHOLD, configuration.getComplexityThreshold());
    }

    @Test
    void asBuilderKeepsSettings() {
        final PlannerConfiguration configuration = PlannerConfiguration.builder()
                .setPlanJoins(false)
                .setComplexityThreshold(17)
                .build();
        final PlannerConfiguration copy = configuration.asBuilder().setPreferArrangedInputs(false).build();
        assertFalse(copy.shouldPlanJoins());
        assertFalse(copy.shouldPreferArrangedInputs());
        assertEquals(17, copy.getComplexityThreshold());
        assertTrue(configuration.shouldPreferArrangedInputs());
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> PlannerConfiguration.builder().setComplexityThreshold(0));
    }
}
