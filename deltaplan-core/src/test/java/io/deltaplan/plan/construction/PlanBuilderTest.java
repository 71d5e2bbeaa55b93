/*
 * PlanBuilderTest.java
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

package io.deltaplan.plan.construction;

import io.deltaplan.PlanComplexityException;
import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanConstructionException.ErrorCode;
import io.deltaplan.dsl.PlanDsl;
import io.deltaplan.logging.LogMessageKeys;
import io.deltaplan.plan.ColumnOrder;
import io.deltaplan.plan.DeltaRule;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.GetNode;
import io.deltaplan.plan.JoinImplementation;
import io.deltaplan.plan.JoinNode;
import io.deltaplan.plan.KeySet;
import io.deltaplan.plan.LetNode;
import io.deltaplan.plan.LocalId;
import io.deltaplan.plan.MapNode;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.RelationNode;
import io.deltaplan.plan.TopKNode;
import io.deltaplan.plan.planning.PlannerConfiguration;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.OptionalLong;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PlanBuilder}.
 */
public class PlanBuilderTest {
    private static final String SOURCE_X = "(defsource x [int64 int64 string])\n";

    static Stream<Arguments> invalidRequests() {
        return Stream.of(
                Arguments.of("unknown source", "(get nope)", ErrorCode.UNRESOLVED_REFERENCE),
                Arguments.of("binding out of scope", "(let a (constant [] [int64]) (get a))\n(get a)", ErrorCode.UNRESOLVED_REFERENCE),
                Arguments.of("map column", SOURCE_X + "(map (get x) [#3])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("map column after map", SOURCE_X + "(map (get x) [#2 #4])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("filter column", SOURCE_X + "(filter (get x) [(call eq #7 1)])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("arrangement key", SOURCE_X + "(arrange_by (get x) [[#0] [#3]])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("top k group", SOURCE_X + "(top_k (get x) [#3] [#0])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("top k order", SOURCE_X + "(top_k (get x) [#0] [(#9 desc)])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("reduce group", SOURCE_X + "(reduce (get x) [#3] [])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("aggregate input", SOURCE_X + "(reduce (get x) [#0] [(sum #5)])", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("join demand", SOURCE_X + "(join [(get x) (get x)] [[#0 #3]] (demand [#6]))", ErrorCode.COLUMN_OUT_OF_RANGE),
                Arguments.of("column in constant", "(constant [[#0]] [int64])", ErrorCode.INVALID_LITERAL_CONTEXT),
                Arguments.of("call in constant", "(constant [[(call add 1 2)]] [int64])", ErrorCode.INVALID_LITERAL_CONTEXT),
                Arguments.of("constraint within one input", SOURCE_X + "(join [(get x) (get x)] [[#0 #1]])", ErrorCode.MALFORMED_CONSTRAINT),
                Arguments.of("constraint column", SOURCE_X + "(join [(get x) (get x)] [[#0 #6]])", ErrorCode.MALFORMED_CONSTRAINT),
                Arguments.of("join without inputs", "(join [] [])", ErrorCode.MALFORMED_CONSTRAINT),
                Arguments.of("cross product", SOURCE_X + "(join [(get x) (get x)] [])", ErrorCode.NO_VALID_JOIN_STRATEGY),
                Arguments.of("disconnected input", SOURCE_X + "(join [(get x) (get x) (get x)] [[#0 #3]])", ErrorCode.NO_VALID_JOIN_STRATEGY),
                Arguments.of("self reference", "(let a (get a) (get a))", ErrorCode.CYCLIC_REFERENCE),
                Arguments.of("indirect self reference", "(let a (map (get a) [1]) (get a))", ErrorCode.CYCLIC_REFERENCE),
                Arguments.of("constant row arity", "(constant [[1 2]] [int64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("constant value type", "(constant [[\"a\"]] [int64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("constant null", "(constant [[null]] [int64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("constant explicit type", "(constant [[(literal 1 int32)]] [int64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("constant out of range", "(constant [[100000]] [int16])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("int16 below range", "(constant [[-32769]] [int16])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("int32 above range", "(constant [[2147483648]] [int32])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("float32 above range", "(constant [[1" + "0".repeat(39) + ".0]] [float32])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("float64 above range", "(constant [[1" + "0".repeat(400) + ".0]] [float64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("float64 below range", "(constant [[-1" + "0".repeat(400) + ".0]] [float64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("float64 loses integer precision", "(constant [[9007199254740993]] [float64])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("untyped decimal above float64 range", SOURCE_X + "(map (get x) [1" + "0".repeat(400) + ".0])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("explicit float32 above range", SOURCE_X + "(map (get x) [(literal 1" + "0".repeat(39) + ".0 float32)])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("untyped null", SOURCE_X + "(map (get x) [null])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("filter not boolean", SOURCE_X + "(filter (get x) [#0])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("aggregate input type", SOURCE_X + "(reduce (get x) [#0] [(sum #2)])", ErrorCode.TYPE_MISMATCH),
                Arguments.of("unknown function", SOURCE_X + "(map (get x) [(call frobnicate #0)])", ErrorCode.INVALID_FUNCTION_CALL),
                Arguments.of("argument types", SOURCE_X + "(map (get x) [(call add #0 #2)])", ErrorCode.INVALID_FUNCTION_CALL),
                Arguments.of("argument count", SOURCE_X + "(map (get x) [(call add #0)])", ErrorCode.INVALID_FUNCTION_CALL),
                Arguments.of("unknown aggregate", SOURCE_X + "(reduce (get x) [#0] [(median #1)])", ErrorCode.INVALID_FUNCTION_CALL),
                Arguments.of("missing delta rule", SOURCE_X + "(join [(get x) (get x)] [[#0 #3]] (delta_query [[(1 [#0])]]))", ErrorCode.INVALID_JOIN_IMPLEMENTATION),
                Arguments.of("unconstrained delta key", SOURCE_X + "(join [(get x) (get x)] [[#0 #3]] (delta_query [[(1 [#1])] [(0 [#0])]]))", ErrorCode.INVALID_JOIN_IMPLEMENTATION),
                Arguments.of("repeated delta input", SOURCE_X + "(join [(get x) (get x)] [[#0 #3]] (delta_query [[(0 [#0])] [(0 [#0])]]))", ErrorCode.INVALID_JOIN_IMPLEMENTATION),
                Arguments.of("empty delta key", SOURCE_X + "(join [(get x) (get x)] [[#0 #3]] (delta_query [[(1 [])] [(0 [#0])]]))", ErrorCode.INVALID_JOIN_IMPLEMENTATION),
                Arguments.of("duplicate source", SOURCE_X + SOURCE_X, ErrorCode.DUPLICATE_DEFINITION),
                Arguments.of("negative limit", SOURCE_X + "(top_k (get x) [] [#0] -1)", ErrorCode.INVALID_ARGUMENT),
                Arguments.of("negative offset", SOURCE_X + "(top_k (get x) [] [#0] null -2)", ErrorCode.INVALID_ARGUMENT)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidRequests")
    void rejectsInvalidRequest(String description, String plan, ErrorCode expectedCode) {
        final PlanConstructionException e = assertThrows(PlanConstructionException.class, () -> PlanDsl.build(plan));
        assertEquals(expectedCode, e.getErrorCode(), () -> description + ": " + e.getMessage());
        assertEquals(expectedCode.getCodeString(), e.getLogInfo().get(LogMessageKeys.CODE.toString()));
    }

    @Test
    void numericConstantsAtTheEdgesOfTheirTypes() {
        final String largeNumeric = "1" + "0".repeat(400) + ".5";
        final PlanGraph graph = PlanDsl.build(String.join("\n",
                "(constant [[-32768 2147483647 16777216 9007199254740992 " + largeNumeric + "]] [int16 int32 float32 float64 numeric])",
                "(constant [[100000000000000000000.0 0.25 2]] [float64 float32 float64])"));
        assertEquals(String.join("\n",
                "%0 =",
                "| Constant (-32768, 2147483647, 16777216, 9007199254740992, " + largeNumeric + ")",
                "",
                "%1 =",
                "| Constant (100000000000000000000, 0.25, 2.0)"),
                graph.explain());
    }

    @Test
    void errorsNameTheOffendingToken() {
        final PlanConstructionException literal = assertThrows(PlanConstructionException.class,
                () -> PlanDsl.build("(constant [[1] [#0]] [int64])"));
        assertEquals("#0", literal.getLogInfo().get(LogMessageKeys.TOKEN.toString()));

        final PlanConstructionException unresolved = assertThrows(PlanConstructionException.class,
                () -> PlanDsl.build("(get missing)"));
        assertEquals("missing", unresolved.getLogInfo().get(LogMessageKeys.NAME.toString()));

        final PlanConstructionException column = assertThrows(PlanConstructionException.class,
                () -> PlanDsl.build(SOURCE_X + "(map (get x) [#3])"));
        assertEquals(3, column.getLogInfo().get(LogMessageKeys.COLUMN.toString()));
        assertEquals(3, column.getLogInfo().get(LogMessageKeys.ARITY.toString()));
    }

    @Test
    void complexityThreshold() {
        final PlannerConfiguration configuration = PlannerConfiguration.builder().setComplexityThreshold(2).build();
        final PlanGraph graph = PlanDsl.build(SOURCE_X + "(filter (get x) [(call gt #0 0)])", configuration);
        assertEquals(2, graph.getNodeCount());

        final PlanComplexityException e = assertThrows(PlanComplexityException.class,
                () -> PlanDsl.build(SOURCE_X + "(map (filter (get x) [(call gt #0 0)]) [#1])", configuration));
        assertEquals(2, e.getLogInfo().get(LogMessageKeys.COMPLEXITY_THRESHOLD.toString()));
    }

    @Test
    void nodeIdsFollowConstructionOrder() {
        final PlanGraph graph = PlanDsl.build(SOURCE_X
                + "(join [(filter (get x) [(call gt #0 1)]) (map (get x) [#0])] [[#0 #3]])\n"
                + "(top_k (get x) [#1] [#0] 5 1)");
        final ImmutableList<RelationNode> nodes = graph.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            final RelationNode node = nodes.get(i);
            assertEquals(i, node.getId());
            for (RelationNode input : node.getInputs()) {
                assertThat(input.getId(), lessThan(node.getId()));
            }
        }
        assertEquals("Join", graph.getResults().get(0).getKind());
        assertEquals("TopK", graph.getResults().get(1).getKind());
        assertEquals(nodes.size() - 1, graph.getResults().get(1).getId());
    }

    @Test
    void arities() {
        final PlanGraph graph = PlanDsl.build(SOURCE_X
                + "(map (get x) [(call add #0 #1) (call neg #3)])\n"
                + "(join [(get x) (get x)] [[#0 #3]])\n"
                + "(reduce (get x) [#2] [(sum #0) (count #1)])\n"
                + "(let a (get x) (arrange_by (get a) [[#1]]))");
        assertEquals(5, graph.getResults().get(0).getArity());
        assertEquals(6, graph.getResults().get(1).getArity());
        assertEquals(3, graph.getResults().get(2).getArity());
        assertEquals(3, graph.getResults().get(3).getArity());

        final MapNode map = (MapNode)graph.getResults().get(0);
        assertEquals(ColumnType.of(ScalarType.INT64), map.getType().getColumnType(4));
        assertEquals(ColumnType.nullable(ScalarType.INT64), graph.getResults().get(2).getType().getColumnType(1));
        assertEquals(ColumnType.of(ScalarType.INT64), graph.getResults().get(2).getType().getColumnType(2));
    }

    @Test
    void letSharesItsValue() {
        final PlanGraph graph = PlanDsl.build(SOURCE_X
                + "(let a (filter (get x) [(call gt #0 1)]) (join [(get a) (get a)] [[#0 #3]]))");
        final LetNode let = (LetNode)graph.getResults().get(0);
        assertEquals(new LocalId(0), let.getLocalId());
        assertSame(let, graph.getBinding(let.getLocalId()));
        assertThat(graph.getBindings().keySet(), contains(new LocalId(0)));

        final JoinNode join = (JoinNode)let.getBody();
        for (RelationNode input : join.getInputs()) {
            final GetNode get = (GetNode)input;
            assertEquals(let.getLocalId(), get.getLocalId());
            assertEquals(let.getValue().getType(), get.getType());
        }
        assertThrows(IllegalArgumentException.class, () -> graph.getBinding(new LocalId(7)));
    }

    @Test
    void innerBindingShadowsOuter() {
        final PlanGraph graph = PlanDsl.build("(let a (constant [[1]] [int64]) (let a (constant [[\"s\"]] [string]) (get a)))");
        final LetNode outer = (LetNode)graph.getResults().get(0);
        final LetNode inner = (LetNode)outer.getBody();
        final GetNode get = (GetNode)inner.getBody();
        assertEquals(new LocalId(1), get.getLocalId());
        assertEquals(ScalarType.STRING, get.getType().getColumnType(0).getScalarType());
    }

    @Test
    void explicitDeltaQueryIsKept() {
        final PlanGraph graph = PlanDsl.build(SOURCE_X
                + "(join [(get x) (get x)] [[#0 #3] [#1 #4]] (delta_query [[(1 [#1])] [(0 [#0 #1])]]))");
        final JoinNode join = (JoinNode)graph.getResults().get(0);
        assertEquals("| |   delta %0 %1.(#1)", graph.explain().split("\n")[9]);
        assertEquals(JoinImplementation.Kind.DELTA_QUERY, join.getImplementation().getKind());
    }

    @Test
    void joinPrefersAnArrangementBuiltInsideABinding() {
        final String plan = String.join("\n",
                "(defsource x [int64 int64])",
                "(defsource y [int64 int64])",
                "(let a (arrange_by (get y) [[#0]]) (join [(get x) (get x) (get a)] [[#0 #2] [#3 #4]]))");
        final DeltaRule preferred = joinOf(PlanDsl.build(plan)).getImplementation().asDeltaQuery().getRules().get(1);
        assertEquals(new DeltaRule(1, ImmutableList.of(new DeltaStep(2, KeySet.of(0)), new DeltaStep(0, KeySet.of(0)))),
                preferred);

        final PlanGraph ignoringArrangements = PlanDsl.build(plan,
                PlannerConfiguration.builder().setPreferArrangedInputs(false).build());
        assertEquals(new DeltaRule(1, ImmutableList.of(new DeltaStep(0, KeySet.of(0)), new DeltaStep(2, KeySet.of(0)))),
                joinOf(ignoringArrangements).getImplementation().asDeltaQuery().getRules().get(1));
    }

    private static JoinNode joinOf(PlanGraph graph) {
        return (JoinNode)((LetNode)graph.getResults().get(0)).getBody();
    }

    @Test
    void joinsAreLeftUnplannedWhenDisabled() {
        final PlanGraph graph = PlanDsl.build(SOURCE_X + "(join [(get x) (get x)] [])",
                PlannerConfiguration.builder().setPlanJoins(false).build());
        final JoinNode join = (JoinNode)graph.getResults().get(0);
        assertEquals(JoinImplementation.Kind.UNPLANNED, join.getImplementation().getKind());
        assertTrue(graph.getArrangements().getArrangements().isEmpty());
    }

    @Test
    void buildFromForms() {
        final ConstructionRequest request = ConstructionRequest.newBuilder()
                .addSource("t", RelationType.of(ColumnType.of(ScalarType.INT64), ColumnType.nullable(ScalarType.STRING)))
                .addResult(RelationForm.topK(
                        RelationForm.filter(RelationForm.get("t"),
                                ImmutableList.of(ScalarForm.call("not", ScalarForm.call("is_null", ScalarForm.column(1))))),
                        ImmutableList.of(1),
                        ImmutableList.of(ColumnOrder.descending(0)),
                        OptionalLong.of(3), 0))
                .build();
        final PlanGraph graph = new PlanBuilder().build(request);
        assertEquals(String.join("\n",
                "%0 =",
                "| Get t (u0)",
                "| Filter not(isnull(#1))",
                "| TopK group=(#1) order=(#0 desc) limit=3 offset=0"),
                graph.explain());
        assertThat(graph.getResults().get(0), instanceOf(TopKNode.class));
    }

    @Test
    void builderIsReusable() {
        final PlanBuilder builder = new PlanBuilder();
        final ConstructionRequest request = PlanDsl.parse(SOURCE_X + "(join [(get x) (get x)] [[#0 #3]])");
        assertEquals(builder.build(request).explain(), builder.build(request).explain());
        assertThrows(PlanConstructionException.class, () -> builder.build(PlanDsl.parse("(get x)")));
        assertEquals(builder.build(request).explain(), new PlanBuilder().build(request).explain());
    }
}
