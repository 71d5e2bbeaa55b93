/*
 * ArrangementRegistryTest.java
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

import io.deltaplan.dsl.PlanDsl;
import io.deltaplan.plan.KeySet;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.SourceDefinition;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ArrangementRegistry}.
 */
public class ArrangementRegistryTest {
    private static final CollectionId X = CollectionId.ofSource(new SourceDefinition("x", 0, RelationType.ofScalars(ScalarType.INT64, ScalarType.INT64)));

    @Test
    void requestsForTheSameKeyShareOneEntry() {
        final ArrangementRegistry.Builder builder = ArrangementRegistry.newBuilder();
        assertTrue(builder.request(X, KeySet.of(0), 3));
        assertFalse(builder.request(X, KeySet.of(0), 5));
        assertFalse(builder.request(X, KeySet.of(0), 5));
        assertTrue(builder.request(X, KeySet.of(0, 0), 5));
        assertTrue(builder.request(CollectionId.ofNode(2), KeySet.of(0), 5));
        final ArrangementRegistry registry = builder.build();

        assertEquals(3, registry.size());
        final Arrangement shared = registry.find(X, KeySet.of(0)).orElseThrow();
        assertThat(shared.getConsumers(), contains(3, 5));
        assertThat(registry.getArrangements(X), contains(shared, registry.find(X, KeySet.of(0, 0)).orElseThrow()));
        assertFalse(registry.find(X, KeySet.of(1)).isPresent());
    }

    @Test
    void builtRegistryIsFrozen() {
        final ArrangementRegistry.Builder builder = ArrangementRegistry.newBuilder();
        builder.request(X, KeySet.of(1), 0);
        builder.build();
        assertThrows(IllegalStateException.class, () -> builder.request(X, KeySet.of(0), 1));
        assertThat(ArrangementRegistry.empty().getArrangements(), empty());
    }

    @Test
    void consumersOfAPlanShareArrangements() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(defsource y [int64 int64])",
                "(arrange_by (get x) [[#0] [#1]])",
                "(join [(get x) (get y)] [[#0 #2]])",
                "(reduce (get x) [#0] [(count #1)])",
                "(top_k (get y) [#0] [#1] 1)"));
        final ArrangementRegistry registry = graph.getArrangements();
        final CollectionId x = CollectionId.ofSource(graph.getSources().get(0));
        final CollectionId y = CollectionId.ofSource(graph.getSources().get(1));

        // arrange_by is node 1, the join node 4, the reduce node 6, the top k node 8
        assertThat(registry.find(x, KeySet.of(0)).orElseThrow().getConsumers(), contains(1, 4, 6));
        assertThat(registry.find(x, KeySet.of(1)).orElseThrow().getConsumers(), contains(1));
        assertThat(registry.find(y, KeySet.of(0)).orElseThrow().getConsumers(), contains(4, 8));
        assertEquals(3, registry.size());
    }

    @Test
    void readsOfABindingShareTheArrangementsOfItsValue() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(let a (filter (get x) [(call gt #1 0)]) (join [(get a) (get a)] [[#0 #3]]))"));
        // the filter is node 1
        final CollectionId a = CollectionId.ofNode(1);
        assertThat(graph.getArrangements().getArrangements(), contains(
                graph.getArrangements().find(a, KeySet.of(1)).orElseThrow(),
                graph.getArrangements().find(a, KeySet.of(0)).orElseThrow()));
    }

    @Test
    void arrangementInsideABindingIsReusedByItsReads() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(let a (arrange_by (get x) [[#0]]) (join [(get a) (get a)] [[#0 #2]]))"));
        final ArrangementRegistry registry = graph.getArrangements();
        final CollectionId x = CollectionId.ofSource(graph.getSources().get(0));

        // arrange_by is node 1, the join node 4
        assertEquals(1, registry.size());
        assertThat(registry.find(x, KeySet.of(0)).orElseThrow().getConsumers(), contains(1, 4));
    }

    @Test
    void nestedBindingsResolveToTheInnermostValue() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(let a (get x) (let b (get a) (reduce (get b) [#1] [(count #0)])))"));
        final CollectionId x = CollectionId.ofSource(graph.getSources().get(0));
        assertThat(graph.getArrangements().getArrangements(), contains(
                graph.getArrangements().find(x, KeySet.of(1)).orElseThrow()));
    }

    @Test
    void expressionGroupKeysAreNotArranged() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(reduce (get x) [(call add #0 1)] [(sum #1)])",
                "(distinct (get x) [])"));
        assertThat(graph.getArrangements().getArrangements(), empty());
    }
}
