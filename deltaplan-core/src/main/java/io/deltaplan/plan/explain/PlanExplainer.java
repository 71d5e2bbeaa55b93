/*
 * PlanExplainer.java
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

import io.deltaplan.annotation.API;
import io.deltaplan.expr.AggregateExpr;
import io.deltaplan.expr.ColumnExpr;
import io.deltaplan.expr.ScalarExpr;
import io.deltaplan.plan.ArrangeByNode;
import io.deltaplan.plan.ColumnOrder;
import io.deltaplan.plan.ConstantNode;
import io.deltaplan.plan.DeltaRule;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.FilterNode;
import io.deltaplan.plan.GetNode;
import io.deltaplan.plan.JoinImplementation;
import io.deltaplan.plan.JoinNode;
import io.deltaplan.plan.KeySet;
import io.deltaplan.plan.LetNode;
import io.deltaplan.plan.LocalId;
import io.deltaplan.plan.MapNode;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.ReduceNode;
import io.deltaplan.plan.RelationNode;
import io.deltaplan.plan.RelationNodeVisitor;
import io.deltaplan.plan.SourceDefinition;
import io.deltaplan.plan.TopKNode;
import io.deltaplan.types.Datum;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a {@link PlanGraph} in the canonical explain format.
 *
 * <p>
 * The output is a sequence of blocks separated by blank lines. Each block starts with a header {@code %<n> =}
 * and continues with pipeline lines {@code | <operator> <parameters>}, one per operator, bottom-up. Constants,
 * reads and joins start a new block; every other operator extends the block of its input, so a block reads as
 * a pipeline. A join refers to the blocks of its inputs, which are emitted before it. The value of a binding is
 * emitted once, in a block whose header is {@code %<n> = Let l<k> =}, and reads of the binding refer to that
 * block. Blocks are numbered contiguously in emission order; results share one numbering.
 * </p>
 *
 * <p>
 * Rendering is deterministic: it only depends on the structure of the graph. The same graph always renders to
 * the same text. The output can be limited to a maximum size, after which it is cut off with a trailing
 * {@code ...}, which is recommended when a plan is attached to log messages.
 * </p>
 */
@API(API.Status.STABLE)
public final class PlanExplainer implements RelationNodeVisitor<Integer> {
    /**
     * Maximum size used when a plan is rendered for a log message.
     */
    public static final int DEFAULT_LOG_MAX_SIZE = 4096;

    private static final String PIPE = "| ";

    @Nonnull
    private final List<Block> blocks = new ArrayList<>();
    @Nonnull
    private final Map<LocalId, Integer> localBlocks = new HashMap<>();

    private PlanExplainer() {
    }

    @Nonnull
    public static String explain(@Nonnull PlanGraph graph) {
        return explain(graph, Integer.MAX_VALUE);
    }

    /**
     * Render a plan graph, truncated to the given size.
     * @param graph the graph
     * @param maxSize the maximum number of characters before the trailing ellipsis
     * @return the explain text
     * @throws IllegalArgumentException if {@code maxSize} is negative
     */
    @Nonnull
    public static String explain(@Nonnull PlanGraph graph, int maxSize) {
        Preconditions.checkArgument(maxSize >= 0, "explain size limit %s is negative", maxSize);
        final PlanExplainer explainer = new PlanExplainer();
        for (RelationNode result : graph.getResults()) {
            explainer.visit(result);
        }
        return explainer.render(maxSize);
    }

    @Nonnull
    private String render(int maxSize) {
        final ExplainWriter writer = new ExplainWriter(maxSize);
        for (int i = 0; i < blocks.size() && !writer.isDone(); i++) {
            final Block block = blocks.get(i);
            if (i > 0) {
                writer.newLine();
                writer.newLine();
            }
            writer.append("%" + i + " =" + (block.header == null ? "" : " " + block.header));
            for (String line : block.lines) {
                writer.newLine();
                writer.append(PIPE + line);
            }
        }
        return writer.toString();
    }

    private int newBlock(@Nonnull String line) {
        final Block block = new Block();
        block.lines.add(line);
        blocks.add(block);
        return blocks.size() - 1;
    }

    private int append(int block, @Nonnull String line) {
        blocks.get(block).lines.add(line);
        return block;
    }

    @Override
    public Integer visitConstant(@Nonnull ConstantNode constant) {
        final StringBuilder line = new StringBuilder("Constant");
        for (List<Datum> row : constant.getRows()) {
            line.append(row.stream().map(Datum::toString).collect(Collectors.joining(", ", " (", ")")));
        }
        return newBlock(line.toString());
    }

    @Override
    public Integer visitGet(@Nonnull GetNode get) {
        final SourceDefinition source = get.getSource();
        if (source != null) {
            return newBlock("Get " + source.getName() + " (" + source.getSourceId() + ")");
        }
        final LocalId localId = Objects.requireNonNull(get.getLocalId());
        final Integer valueBlock = localBlocks.get(localId);
        Verify.verify(valueBlock != null, "read of %s before its binding", localId);
        return newBlock("Get %" + valueBlock + " (" + localId + ")");
    }

    @Override
    public Integer visitLet(@Nonnull LetNode let) {
        final int valueBlock = visit(let.getValue());
        final Block block = blocks.get(valueBlock);
        Verify.verify(block.header == null, "block %s already bound", valueBlock);
        block.header = "Let " + let.getLocalId() + " =";
        localBlocks.put(let.getLocalId(), valueBlock);
        return visit(let.getBody());
    }

    @Override
    public Integer visitMap(@Nonnull MapNode map) {
        return append(visit(map.getInput()), "Map " + explainScalars(map.getScalars()));
    }

    @Override
    public Integer visitFilter(@Nonnull FilterNode filter) {
        return append(visit(filter.getInput()), "Filter " + explainScalars(filter.getPredicates()));
    }

    @Override
    public Integer visitArrangeBy(@Nonnull ArrangeByNode arrangeBy) {
        final StringBuilder line = new StringBuilder("ArrangeBy");
        for (KeySet key : arrangeBy.getKeys()) {
            line.append(' ').append(key.explain());
        }
        return append(visit(arrangeBy.getInput()), line.toString());
    }

    @Override
    public Integer visitJoin(@Nonnull JoinNode join) {
        final List<Integer> inputBlocks = new ArrayList<>(join.getInputs().size());
        for (RelationNode input : join.getInputs()) {
            inputBlocks.add(visit(input));
        }
        final StringBuilder line = new StringBuilder("Join");
        for (Integer inputBlock : inputBlocks) {
            line.append(" %").append(inputBlock);
        }
        for (List<Integer> equivalence : join.getEquivalences()) {
            line.append(" (=");
            for (Integer column : equivalence) {
                line.append(' ').append(ColumnExpr.explainColumn(column));
            }
            line.append(')');
        }
        final int block = newBlock(line.toString());

        final JoinImplementation implementation = join.getImplementation();
        if (implementation.getKind() == JoinImplementation.Kind.DELTA_QUERY) {
            append(block, PIPE + "implementation = DeltaQuery");
            for (DeltaRule rule : implementation.asDeltaQuery().getRules()) {
                final StringBuilder delta = new StringBuilder(PIPE + "  delta %").append(inputBlocks.get(rule.getChangedInput()));
                for (DeltaStep step : rule.getSteps()) {
                    delta.append(" %").append(inputBlocks.get(step.getInput())).append('.').append(step.getKey().explain());
                }
                append(block, delta.toString());
            }
        } else {
            append(block, PIPE + "implementation = " + implementation);
        }
        join.getDemand().ifPresent(demand -> append(block, PIPE + "demand = " + explainColumns(demand)));
        return block;
    }

    @Override
    public Integer visitReduce(@Nonnull ReduceNode reduce) {
        final int block = visit(reduce.getInput());
        final String group = "group=(" + explainScalars(reduce.getGroupKey()) + ")";
        if (reduce.isDistinct()) {
            return append(block, "Distinct " + group);
        }
        append(block, "Reduce " + group);
        for (AggregateExpr aggregate : reduce.getAggregates()) {
            append(block, PIPE + "agg " + aggregate.explain());
        }
        return block;
    }

    @Override
    public Integer visitTopK(@Nonnull TopKNode topK) {
        final StringBuilder line = new StringBuilder("TopK group=")
                .append(explainColumns(topK.getGroupKey()))
                .append(" order=(")
                .append(topK.getOrder().stream().map(ColumnOrder::explain).collect(Collectors.joining(", ")))
                .append(')');
        topK.getLimit().ifPresent(limit -> line.append(" limit=").append(limit));
        line.append(" offset=").append(topK.getOffset());
        return append(visit(topK.getInput()), line.toString());
    }

    @Nonnull
    private static String explainScalars(@Nonnull ImmutableList<ScalarExpr> scalars) {
        return scalars.stream().map(ScalarExpr::explain).collect(Collectors.joining(", "));
    }

    @Nonnull
    private static String explainColumns(@Nonnull Iterable<Integer> columns) {
        final List<String> rendered = new ArrayList<>();
        for (Integer column : columns) {
            rendered.add(ColumnExpr.explainColumn(column));
        }
        return "(" + String.join(", ", rendered) + ")";
    }

    private static final class Block {
        @Nullable
        private String header;
        @Nonnull
        private final List<String> lines = new ArrayList<>();
    }
}
