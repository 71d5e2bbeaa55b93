/*
 * RelationForm.java
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

import io.deltaplan.annotation.API;
import io.deltaplan.plan.ColumnOrder;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.types.RelationType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.OptionalLong;

/**
 * An unvalidated relational expression in a construction request. Sub-forms are named positionally. The
 * static factories mirror the node kinds.
 */
@API(API.Status.STABLE)
public abstract class RelationForm implements TopLevelForm {
    private RelationForm() {
    }

    public abstract <T> T accept(@Nonnull RelationFormVisitor<T> visitor);

    @Nonnull
    public static ConstantForm constant(@Nonnull List<? extends List<ScalarForm>> rows, @Nonnull RelationType type) {
        return new ConstantForm(copyRows(rows), type);
    }

    @Nonnull
    public static GetForm get(@Nonnull String name) {
        return new GetForm(name);
    }

    @Nonnull
    public static LetForm let(@Nonnull String name, @Nonnull RelationForm value, @Nonnull RelationForm body) {
        return new LetForm(name, value, body);
    }

    @Nonnull
    public static MapForm map(@Nonnull RelationForm input, @Nonnull List<ScalarForm> scalars) {
        return new MapForm(input, ImmutableList.copyOf(scalars));
    }

    @Nonnull
    public static FilterForm filter(@Nonnull RelationForm input, @Nonnull List<ScalarForm> predicates) {
        return new FilterForm(input, ImmutableList.copyOf(predicates));
    }

    @Nonnull
    public static ArrangeByForm arrangeBy(@Nonnull RelationForm input, @Nonnull List<? extends List<Integer>> keys) {
        return new ArrangeByForm(input, copyColumnLists(keys));
    }

    @Nonnull
    public static JoinForm join(@Nonnull List<RelationForm> inputs, @Nonnull List<? extends List<Integer>> equivalences) {
        return new JoinForm(ImmutableList.copyOf(inputs), copyColumnLists(equivalences), null, null);
    }

    /**
     * A join with optional demand and an optional explicit delta query.
     * @param inputs the join inputs
     * @param equivalences the equality constraints over the concatenated row
     * @param demand the demanded output columns, or {@code null} if unknown
     * @param deltaQuery one list of steps per changed input, in input order, or {@code null} to let the planner choose
     * @return the form
     */
    @Nonnull
    public static JoinForm join(@Nonnull List<RelationForm> inputs, @Nonnull List<? extends List<Integer>> equivalences,
                                @Nullable List<Integer> demand, @Nullable List<? extends List<DeltaStep>> deltaQuery) {
        ImmutableList<ImmutableList<DeltaStep>> rules = null;
        if (deltaQuery != null) {
            final ImmutableList.Builder<ImmutableList<DeltaStep>> builder = ImmutableList.builder();
            for (List<DeltaStep> rule : deltaQuery) {
                builder.add(ImmutableList.copyOf(rule));
            }
            rules = builder.build();
        }
        return new JoinForm(ImmutableList.copyOf(inputs), copyColumnLists(equivalences),
                demand == null ? null : ImmutableList.copyOf(demand), rules);
    }

    @Nonnull
    public static ReduceForm reduce(@Nonnull RelationForm input, @Nonnull List<ScalarForm> groupKey, @Nonnull List<AggregateForm> aggregates) {
        return new ReduceForm(input, ImmutableList.copyOf(groupKey), ImmutableList.copyOf(aggregates));
    }

    @Nonnull
    public static ReduceForm distinct(@Nonnull RelationForm input, @Nonnull List<ScalarForm> groupKey) {
        return new ReduceForm(input, ImmutableList.copyOf(groupKey), ImmutableList.of());
    }

    @Nonnull
    public static TopKForm topK(@Nonnull RelationForm input, @Nonnull List<Integer> groupKey, @Nonnull List<ColumnOrder> order,
                                @Nonnull OptionalLong limit, long offset) {
        return new TopKForm(input, ImmutableList.copyOf(groupKey), ImmutableList.copyOf(order), limit, offset);
    }

    @Nonnull
    private static ImmutableList<ImmutableList<ScalarForm>> copyRows(@Nonnull List<? extends List<ScalarForm>> rows) {
        final ImmutableList.Builder<ImmutableList<ScalarForm>> builder = ImmutableList.builderWithExpectedSize(rows.size());
        for (List<ScalarForm> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        return builder.build();
    }

    @Nonnull
    private static ImmutableList<ImmutableList<Integer>> copyColumnLists(@Nonnull List<? extends List<Integer>> lists) {
        final ImmutableList.Builder<ImmutableList<Integer>> builder = ImmutableList.builderWithExpectedSize(lists.size());
        for (List<Integer> list : lists) {
            builder.add(ImmutableList.copyOf(list));
        }
        return builder.build();
    }

    /**
     * Literal rows with a declared row type.
     */
    public static final class ConstantForm extends RelationForm {
        @Nonnull
        private final ImmutableList<ImmutableList<ScalarForm>> rows;
        @Nonnull
        private final RelationType type;

        private ConstantForm(@Nonnull ImmutableList<ImmutableList<ScalarForm>> rows, @Nonnull RelationType type) {
            this.rows = rows;
            this.type = type;
        }

        @Nonnull
        public ImmutableList<ImmutableList<ScalarForm>> getRows() {
            return rows;
        }

        @Nonnull
        public RelationType getType() {
            return type;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /**
     * A read of a source or binding by name.
     */
    public static final class GetForm extends RelationForm {
        @Nonnull
        private final String name;

        private GetForm(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitGet(this);
        }
    }

    /**
     * A binding of a name to a value, visible in the body only.
     */
    public static final class LetForm extends RelationForm {
        @Nonnull
        private final String name;
        @Nonnull
        private final RelationForm value;
        @Nonnull
        private final RelationForm body;

        private LetForm(@Nonnull String name, @Nonnull RelationForm value, @Nonnull RelationForm body) {
            this.name = name;
            this.value = value;
            this.body = body;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public RelationForm getValue() {
            return value;
        }

        @Nonnull
        public RelationForm getBody() {
            return body;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitLet(this);
        }
    }

    /**
     * Appended computed columns.
     */
    public static final class MapForm extends RelationForm {
        @Nonnull
        private final RelationForm input;
        @Nonnull
        private final ImmutableList<ScalarForm> scalars;

        private MapForm(@Nonnull RelationForm input, @Nonnull ImmutableList<ScalarForm> scalars) {
            this.input = input;
            this.scalars = scalars;
        }

        @Nonnull
        public RelationForm getInput() {
            return input;
        }

        @Nonnull
        public ImmutableList<ScalarForm> getScalars() {
            return scalars;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitMap(this);
        }
    }

    /**
     * A conjunction of predicates.
     */
    public static final class FilterForm extends RelationForm {
        @Nonnull
        private final RelationForm input;
        @Nonnull
        private final ImmutableList<ScalarForm> predicates;

        private FilterForm(@Nonnull RelationForm input, @Nonnull ImmutableList<ScalarForm> predicates) {
            this.input = input;
            this.predicates = predicates;
        }

        @Nonnull
        public RelationForm getInput() {
            return input;
        }

        @Nonnull
        public ImmutableList<ScalarForm> getPredicates() {
            return predicates;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitFilter(this);
        }
    }

    /**
     * Requested arrangements of the input.
     */
    public static final class ArrangeByForm extends RelationForm {
        @Nonnull
        private final RelationForm input;
        @Nonnull
        private final ImmutableList<ImmutableList<Integer>> keys;

        private ArrangeByForm(@Nonnull RelationForm input, @Nonnull ImmutableList<ImmutableList<Integer>> keys) {
            this.input = input;
            this.keys = keys;
        }

        @Nonnull
        public RelationForm getInput() {
            return input;
        }

        @Nonnull
        public ImmutableList<ImmutableList<Integer>> getKeys() {
            return keys;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitArrangeBy(this);
        }
    }

    /**
     * An equijoin of the inputs.
     */
    public static final class JoinForm extends RelationForm {
        @Nonnull
        private final ImmutableList<RelationForm> inputs;
        @Nonnull
        private final ImmutableList<ImmutableList<Integer>> equivalences;
        @Nullable
        private final ImmutableList<Integer> demand;
        @Nullable
        private final ImmutableList<ImmutableList<DeltaStep>> deltaQuery;

        private JoinForm(@Nonnull ImmutableList<RelationForm> inputs, @Nonnull ImmutableList<ImmutableList<Integer>> equivalences,
                         @Nullable ImmutableList<Integer> demand, @Nullable ImmutableList<ImmutableList<DeltaStep>> deltaQuery) {
            this.inputs = inputs;
            this.equivalences = equivalences;
            this.demand = demand;
            this.deltaQuery = deltaQuery;
        }

        @Nonnull
        public ImmutableList<RelationForm> getInputs() {
            return inputs;
        }

        @Nonnull
        public ImmutableList<ImmutableList<Integer>> getEquivalences() {
            return equivalences;
        }

        @Nullable
        public ImmutableList<Integer> getDemand() {
            return demand;
        }

        @Nullable
        public ImmutableList<ImmutableList<DeltaStep>> getDeltaQuery() {
            return deltaQuery;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitJoin(this);
        }
    }

    /**
     * A grouping with aggregates; a distinct when there are none.
     */
    public static final class ReduceForm extends RelationForm {
        @Nonnull
        private final RelationForm input;
        @Nonnull
        private final ImmutableList<ScalarForm> groupKey;
        @Nonnull
        private final ImmutableList<AggregateForm> aggregates;

        private ReduceForm(@Nonnull RelationForm input, @Nonnull ImmutableList<ScalarForm> groupKey, @Nonnull ImmutableList<AggregateForm> aggregates) {
            this.input = input;
            this.groupKey = groupKey;
            this.aggregates = aggregates;
        }

        @Nonnull
        public RelationForm getInput() {
            return input;
        }

        @Nonnull
        public ImmutableList<ScalarForm> getGroupKey() {
            return groupKey;
        }

        @Nonnull
        public ImmutableList<AggregateForm> getAggregates() {
            return aggregates;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitReduce(this);
        }
    }

    /**
     * A per-group ordered limit.
     */
    public static final class TopKForm extends RelationForm {
        @Nonnull
        private final RelationForm input;
        @Nonnull
        private final ImmutableList<Integer> groupKey;
        @Nonnull
        private final ImmutableList<ColumnOrder> order;
        @Nonnull
        private final OptionalLong limit;
        private final long offset;

        private TopKForm(@Nonnull RelationForm input, @Nonnull ImmutableList<Integer> groupKey, @Nonnull ImmutableList<ColumnOrder> order,
                         @Nonnull OptionalLong limit, long offset) {
            this.input = input;
            this.groupKey = groupKey;
            this.order = order;
            this.limit = limit;
            this.offset = offset;
        }

        @Nonnull
        public RelationForm getInput() {
            return input;
        }

        @Nonnull
        public ImmutableList<Integer> getGroupKey() {
            return groupKey;
        }

        @Nonnull
        public ImmutableList<ColumnOrder> getOrder() {
            return order;
        }

        @Nonnull
        public OptionalLong getLimit() {
            return limit;
        }

        public long getOffset() {
            return offset;
        }

        @Override
        public <T> T accept(@Nonnull RelationFormVisitor<T> visitor) {
            return visitor.visitTopK(this);
        }
    }
}
