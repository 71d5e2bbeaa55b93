/*
 * DeltaQueryPlannerTest.java
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

import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanConstructionException.ErrorCode;
import io.deltaplan.plan.DeltaRule;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.JoinImplementation;
import io.deltaplan.plan.JoinInputMapper;
import io.deltaplan.plan.KeySet;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DeltaQueryPlanner}.
 */
public class DeltaQueryPlannerTest {
    private final DeltaQueryPlanner planner = new DeltaQueryPlanner(PlannerConfiguration.defaultPlannerConfiguration());

    private static JoinInputMapper arities(Integer... arities) {
        return new JoinInputMapper(ImmutableList.copyOf(arities));
    }

    private static ImmutableList<ImmutableList<Integer>> equivalences(List<List<Integer>> equivalences) {
        return EquivalenceClasses.canonicalize(equivalences);
    }

    private static DeltaRule rule(int changed, DeltaStep... steps) {
        return new DeltaRule(changed, ImmutableList.copyOf(steps));
    }

    private static DeltaStep step(int input, Integer... key) {
        return new DeltaStep(input, KeySet.of(key));
    }

    @Test
    void twoWayJoin() {
        final JoinImplementation.DeltaQuery deltaQuery = planner.plan(arities(2, 2),
                equivalences(List.of(List.of(0, 3))), DeltaQueryPlanner.ArrangementLookup.NONE);
        assertThat(deltaQuery.getRules(), contains(
                rule(0, step(1, 1)),
                rule(1, step(0, 0))));
    }

    @Test
    void everyRuleVisitsEveryOtherInputOnce() {
        final JoinInputMapper mapper = arities(2, 3, 1, 2);
        final JoinImplementation.DeltaQuery deltaQuery = planner.plan(mapper,
                equivalences(List.of(List.of(0, 2), List.of(4, 5), List.of(1, 6))), DeltaQueryPlanner.ArrangementLookup.NONE);
        assertEquals(4, deltaQuery.getRules().size());
        for (int changed = 0; changed < 4; changed++) {
            final DeltaRule rule = deltaQuery.getRules().get(changed);
            assertEquals(changed, rule.getChangedInput());
            final BitSet seen = new BitSet();
            seen.set(changed);
            for (DeltaStep step : rule.getSteps()) {
                assertTrue(!seen.get(step.getInput()), "input probed twice");
                assertTrue(!step.getKey().isEmpty(), "cross product step");
                seen.set(step.getInput());
            }
            assertEquals(4, seen.cardinality());
        }
        // the plan also passes validation
        planner.validate(mapper, equivalences(List.of(List.of(0, 2), List.of(4, 5), List.of(1, 6))), deltaQuery);
    }

    @Test
    void chain() {
        final JoinImplementation.DeltaQuery deltaQuery = planner.plan(arities(2, 2, 2),
                equivalences(List.of(List.of(0, 2), List.of(3, 4))), DeltaQueryPlanner.ArrangementLookup.NONE);
        assertThat(deltaQuery.getRules(), contains(
                rule(0, step(1, 0), step(2, 0)),
                rule(1, step(0, 0), step(2, 0)),
                rule(2, step(1, 1), step(0, 0))));
    }

    @Test
    void prefersLongerKeys() {
        final JoinImplementation.DeltaQuery deltaQuery = planner.plan(arities(3, 2, 2),
                equivalences(List.of(List.of(0, 3), List.of(1, 5), List.of(2, 6))), DeltaQueryPlanner.ArrangementLookup.NONE);
        assertEquals(rule(0, step(2, 0, 1), step(1, 0)), deltaQuery.getRules().get(0));
    }

    @Test
    void prefersArrangedInputs() {
        final JoinInputMapper mapper = arities(2, 2, 2);
        final ImmutableList<ImmutableList<Integer>> equivalences = equivalences(List.of(List.of(0, 2), List.of(3, 4)));
        final DeltaQueryPlanner.ArrangementLookup lookup = (input, key) -> input == 2 && key.equals(KeySet.of(0));

        assertEquals(rule(1, step(2, 0), step(0, 0)), planner.plan(mapper, equivalences, lookup).getRules().get(1));

        final DeltaQueryPlanner ignoringArrangements = new DeltaQueryPlanner(
                PlannerConfiguration.builder().setPreferArrangedInputs(false).build());
        assertEquals(rule(1, step(0, 0), step(2, 0)), ignoringArrangements.plan(mapper, equivalences, lookup).getRules().get(1));
    }

    @Test
    void equivalentConstraintsPlanIdentically() {
        final JoinInputMapper mapper = arities(2, 2, 2);
        final JoinImplementation.DeltaQuery first = planner.plan(mapper,
                equivalences(List.of(List.of(0, 2), List.of(3, 4))), DeltaQueryPlanner.ArrangementLookup.NONE);
        final JoinImplementation.DeltaQuery second = planner.plan(mapper,
                equivalences(List.of(List.of(4, 3), List.of(2, 0, 0))), DeltaQueryPlanner.ArrangementLookup.NONE);
        assertEquals(first, second);
        assertEquals(first, planner.plan(mapper,
                equivalences(List.of(List.of(0, 2), List.of(3, 4))), DeltaQueryPlanner.ArrangementLookup.NONE));
    }

    @Test
    void probeKeyUsesSmallestColumnPerClass() {
        final JoinInputMapper mapper = arities(2, 3);
        final BitSet bound = new BitSet();
        bound.set(0);
        // input 1 has columns 2, 3 and 4; the class {1, 3, 4} contributes its smallest, local column 1
        final KeySet key = DeltaQueryPlanner.probeKey(mapper,
                equivalences(List.of(List.of(4, 1, 3), List.of(0, 2))), bound, 1);
        assertEquals(KeySet.of(0, 1), key);
        assertTrue(DeltaQueryPlanner.probeKey(mapper, equivalences(List.of(List.of(4, 1, 3))), new BitSet(), 1).isEmpty());
    }

    @Test
    void disconnectedJoin() {
        final PlanConstructionException e = assertThrows(PlanConstructionException.class,
                () -> planner.plan(arities(1, 1, 1), equivalences(List.of(List.of(0, 1))), DeltaQueryPlanner.ArrangementLookup.NONE));
        assertEquals(ErrorCode.NO_VALID_JOIN_STRATEGY, e.getErrorCode());
    }

    @Test
    void singleInput() {
        assertThat(planner.plan(arities(3), ImmutableList.of(), DeltaQueryPlanner.ArrangementLookup.NONE).getRules(),
                contains(rule(0)));
    }

    @Test
    void validateRejectsRulesOutOfOrder() {
        final JoinInputMapper mapper = arities(2, 2);
        final ImmutableList<ImmutableList<Integer>> equivalences = equivalences(List.of(List.of(0, 3)));
        final JoinImplementation.DeltaQuery swapped = JoinImplementation.deltaQuery(ImmutableList.of(
                rule(1, step(0, 0)),
                rule(0, step(1, 1))));
        final PlanConstructionException e = assertThrows(PlanConstructionException.class,
                () -> planner.validate(mapper, equivalences, swapped));
        assertEquals(ErrorCode.INVALID_JOIN_IMPLEMENTATION, e.getErrorCode());

        final JoinImplementation.DeltaQuery outOfRange = JoinImplementation.deltaQuery(ImmutableList.of(
                rule(0, step(1, 2)),
                rule(1, step(0, 0))));
        assertEquals(ErrorCode.INVALID_JOIN_IMPLEMENTATION, assertThrows(PlanConstructionException.class,
                () -> planner.validate(mapper, equivalences, outOfRange)).getErrorCode());

        planner.validate(mapper, equivalences, JoinImplementation.deltaQuery(ImmutableList.of(
                rule(0, step(1, 1)),
                rule(1, step(0, 0)))));
    }
}
