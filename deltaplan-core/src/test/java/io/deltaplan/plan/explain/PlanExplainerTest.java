/*
 * PlanExplainerTest.java
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

package io.deltaplan.plan.explain;

import io.deltaplan.dsl.PlanDsl;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.construction.ConstructionRequest;
import io.deltaplan.plan.construction.PlanBuilder;
import io.deltaplan.plan.construction.RelationForm;
import io.deltaplan.plan.construction.ScalarForm;
import io.deltaplan.plan.planning.PlannerConfiguration;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Golden tests for {@link PlanExplainer}.
 */
public class PlanExplainerTest {
    private static String explain(String... lines) {
        return PlanDsl.build(String.join("\n", lines)).explain();
    }

    private static String expected(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    void constant() {
        assertEquals(expected(
                "%0 =",
                "| Constant (1, 2, 3) (4, 5, 6)"),
                explain("(constant [[1 2 3] [4 5 6]] [int64 int64 int64])"));
    }

    @Test
    void emptyConstant() {
        assertEquals(expected(
                "%0 =",
                "| Constant"),
                explain("(constant [] [int64])"));
    }

    @Test
    void constantOfMixedTypes() {
        assertEquals(expected(
                "%0 =",
                "| Constant (true, \"a\\\"b\", null, 1.5)"),
                explain("(constant [[true \"a\\\"b\" null 1.5]] [bool string (int32 null) float64])"));
    }

    @Test
    void constantBuiltFromForms() {
        final ConstructionRequest request = ConstructionRequest.newBuilder()
                .addResult(RelationForm.constant(
                        ImmutableList.of(
                                ImmutableList.of(ScalarForm.literal(1), ScalarForm.literal(2), ScalarForm.literal(3)),
                                ImmutableList.of(ScalarForm.literal(4), ScalarForm.literal(5), ScalarForm.literal(6))),
                        RelationType.ofScalars(ScalarType.INT64, ScalarType.INT64, ScalarType.INT64)))
                .build();
        final PlanGraph graph = new PlanBuilder().build(request);
        assertEquals(expected("%0 =", "| Constant (1, 2, 3) (4, 5, 6)"), graph.explain());
    }

    @Test
    void arrangeBy() {
        assertEquals(expected(
                "%0 =",
                "| Constant (1, 2, 3) (4, 5, 6)",
                "| ArrangeBy (#0) (#1)"),
                explain("(arrange_by (constant [[1 2 3] [4 5 6]] [int64 int64 int64]) [[#0] [#1]])"));
    }

    @Test
    void arrangeByKeepsRepeatedColumns() {
        assertEquals(expected(
                "%0 =",
                "| Constant (1, 2, 3) (4, 5, 6)",
                "| ArrangeBy (#0, #0) (#1)"),
                explain("(arrange_by (constant [[1 2 3] [4 5 6]] [int64 int64 int64]) [[#0 #0] [#1]])"));
    }

    @Test
    void arrangeByCollapsesDuplicateKeys() {
        assertEquals(expected(
                "%0 =",
                "| Constant (1, 2)",
                "| ArrangeBy (#1) (#0)"),
                explain("(arrange_by (constant [[1 2]] [int64 int64]) [[#1] [#0] [#1]])"));
    }

    @Test
    void let() {
        assertEquals(expected(
                "%0 = Let l0 =",
                "| Constant (1, 2, 3) (4, 5, 6)",
                "",
                "%1 =",
                "| Get %0 (l0)"),
                explain("(let a (constant [[1 2 3] [4 5 6]] [int64 int64 int64]) (get a))"));
    }

    @Test
    void nestedLets() {
        assertEquals(expected(
                "%0 = Let l0 =",
                "| Constant (1)",
                "",
                "%1 = Let l1 =",
                "| Get %0 (l0)",
                "| Map (#0 + 1)",
                "",
                "%2 =",
                "| Get %1 (l1)"),
                explain("(let a (constant [[1]] [int64])",
                        "  (let b (map (get a) [(call add #0 1)])",
                        "    (get b)))"));
    }

    @Test
    void twoWayJoin() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "",
                "%1 =",
                "| Get x (u0)",
                "",
                "%2 =",
                "| Join %0 %1 (= #0 #3)",
                "| | implementation = DeltaQuery",
                "| |   delta %0 %1.(#1)",
                "| |   delta %1 %0.(#0)",
                "| | demand = (#0, #1)"),
                explain("(defsource x [int64 int64])",
                        "(join [(get x) (get x)] [[#0 #3]] (demand [#1 #0]))"));
    }

    @Test
    void threeWayJoin() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "",
                "%1 =",
                "| Get y (u1)",
                "",
                "%2 =",
                "| Get x (u0)",
                "",
                "%3 =",
                "| Join %0 %1 %2 (= #0 #2) (= #3 #4)",
                "| | implementation = DeltaQuery",
                "| |   delta %0 %1.(#0) %2.(#0)",
                "| |   delta %1 %0.(#0) %2.(#0)",
                "| |   delta %2 %1.(#1) %0.(#0)"),
                explain("(defsource x [int64 int64])",
                        "(defsource y [int64 int64])",
                        "(join [(get x) (get y) (get x)] [[#4 #3] [#2 #0]])"));
    }

    @Test
    void singleInputJoin() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "",
                "%1 =",
                "| Join %0",
                "| | implementation = DeltaQuery",
                "| |   delta %0"),
                explain("(defsource x [int64])",
                        "(join [(get x)] [])"));
    }

    @Test
    void unplannedJoin() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(join [(get x) (get x)] [[#0 #3]])"),
                PlannerConfiguration.builder().setPlanJoins(false).build());
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "",
                "%1 =",
                "| Get x (u0)",
                "",
                "%2 =",
                "| Join %0 %1 (= #0 #3)",
                "| | implementation = Unimplemented"),
                graph.explain());
    }

    @Test
    void joinOverPipelines() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Filter (#1 > 5)",
                "",
                "%1 =",
                "| Get x (u0)",
                "",
                "%2 =",
                "| Join %0 %1 (= #0 #2)",
                "| | implementation = DeltaQuery",
                "| |   delta %0 %1.(#0)",
                "| |   delta %1 %0.(#0)",
                "| Map (#1 * #3)"),
                explain("(defsource x [int64 int64])",
                        "(map (join [(filter (get x) [(call gt #1 5)]) (get x)] [[#0 #2]]) [(call mul #1 #3)])"));
    }

    @Test
    void reduce() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Reduce group=(#0)",
                "| | agg sum(#1)",
                "| | agg count(distinct #2)"),
                explain("(defsource x [int64 int64 string])",
                        "(reduce (get x) [#0] [(sum #1) (count #2 distinct)])"));
    }

    @Test
    void reduceWithoutAggregatesIsDistinct() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Distinct group=(#2)"),
                explain("(defsource x [int64 int64 string])",
                        "(reduce (get x) [#2] [])"));
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Distinct group=(#2)"),
                explain("(defsource x [int64 int64 string])",
                        "(distinct (get x) [#2])"));
    }

    @Test
    void reduceOverExpressions() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Reduce group=((#0 % 10), isnull(#1))",
                "| | agg max(#1)"),
                explain("(defsource x [int64 (int64 null)])",
                        "(reduce (get x) [(call mod #0 10) (call is_null #1)] [(max #1)])"));
    }

    @Test
    void topK() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| TopK group=(#1) order=(#0 asc) limit=5 offset=1"),
                explain("(defsource x [int64 int64])",
                        "(top_k (get x) [#1] [#0] 5 1)"));
    }

    @Test
    void topKWithoutLimit() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| TopK group=() order=(#0 desc, #1 asc) offset=0"),
                explain("(defsource x [int64 int64])",
                        "(top_k (get x) [] [(#0 desc) (#1 asc)])"));
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| TopK group=(#0) order=() offset=3"),
                explain("(defsource x [int64 int64])",
                        "(top_k (get x) [#0] [] null 3)"));
    }

    @Test
    void multipleResultsShareNumbering() {
        assertEquals(expected(
                "%0 =",
                "| Get x (u0)",
                "| Filter (#0 = 1)",
                "",
                "%1 =",
                "| Constant (7)"),
                explain("(defsource x [int64])",
                        "(filter (get x) [(call eq #0 1)])",
                        "(constant [[7]] [int64])"));
    }

    @Test
    void explainIsStable() {
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(defsource x [int64 int64])",
                "(let j (join [(get x) (get x)] [[#0 #3]]) (top_k (get j) [#1] [#0] 5 1))"));
        assertEquals(graph.explain(), graph.explain());
        assertEquals(graph.explain(), PlanExplainer.explain(graph));
    }

    @Test
    void truncation() {
        final PlanGraph graph = PlanDsl.build("(constant [[1 2 3] [4 5 6]] [int64 int64 int64])");
        final String truncated = PlanExplainer.explain(graph, 10);
        assertEquals("%0 =\n| Con...", truncated);
        assertThat(PlanExplainer.explain(graph, 1000), endsWith("(4, 5, 6)"));
        assertThat(graph.toString(), startsWith("%0 ="));
        assertEquals("...", PlanExplainer.explain(graph, 0));
        assertThrows(IllegalArgumentException.class, () -> PlanExplainer.explain(graph, -1));
    }
}
