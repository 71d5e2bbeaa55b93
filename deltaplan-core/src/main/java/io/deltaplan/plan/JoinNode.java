/*
 * JoinNode.java
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

package io.deltaplan.plan;

import io.deltaplan.annotation.API;
import io.deltaplan.types.RelationType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * An equijoin of any number of inputs. The output row is the concatenation of the input rows; the
 * equivalences list classes of concatenated-row columns that must hold equal values.
 *
 * <p>
 * Equivalences are stored in canonical form: every class is sorted and free of duplicates, no two classes share
 * a column, and the classes are ordered by their smallest column.
 * </p>
 */
@API(API.Status.STABLE)
public final class JoinNode extends RelationNode {
    @Nonnull
    private final ImmutableList<RelationNode> inputs;
    @Nonnull
    private final ImmutableList<ImmutableList<Integer>> equivalences;
    @Nullable
    private final ImmutableSortedSet<Integer> demand;
    @Nonnull
    private final JoinImplementation implementation;

    public JoinNode(int id, @Nonnull List<? extends RelationNode> inputs, @Nonnull List<? extends List<Integer>> equivalences,
                    @Nullable ImmutableSortedSet<Integer> demand, @Nonnull JoinImplementation implementation) {
        super(id, outputType(inputs));
        this.inputs = ImmutableList.copyOf(inputs);
        final ImmutableList.Builder<ImmutableList<Integer>> builder = ImmutableList.builderWithExpectedSize(equivalences.size());
        for (List<Integer> equivalence : equivalences) {
            builder.add(ImmutableList.copyOf(equivalence));
        }
        this.equivalences = builder.build();
        this.demand = demand;
        this.implementation = implementation;
    }

    @Nonnull
    private static RelationType outputType(@Nonnull List<? extends RelationNode> inputs) {
        RelationType type = RelationType.empty();
        for (RelationNode input : inputs) {
            type = type.concat(input.getType());
        }
        return type;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return inputs;
    }

    @Nonnull
    public ImmutableList<ImmutableList<Integer>> getEquivalences() {
        return equivalences;
    }

    /**
     * The output columns consumers of this join need, if known.
     * @return the demanded columns in ascending order, or empty if every column may be needed
     */
    @Nonnull
    public Optional<ImmutableSortedSet<Integer>> getDemand() {
        return Optional.ofNullable(demand);
    }

    @Nonnull
    public JoinImplementation getImplementation() {
        return implementation;
    }

    @Nonnull
    public JoinInputMapper getInputMapper() {
        return JoinInputMapper.forInputs(inputs);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitJoin(this);
    }
}
