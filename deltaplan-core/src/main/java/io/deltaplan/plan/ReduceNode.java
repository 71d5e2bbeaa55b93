/*
 * ReduceNode.java
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
import io.deltaplan.expr.AggregateExpr;
import io.deltaplan.expr.ScalarExpr;
import io.deltaplan.types.RelationType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Groups input rows by the values of the group key and produces one row per group: the key columns followed by
 * one column per aggregate. With no aggregates this is a distinct over the key.
 */
@API(API.Status.STABLE)
public final class ReduceNode extends RelationNode {
    @Nonnull
    private final RelationNode input;
    @Nonnull
    private final ImmutableList<ScalarExpr> groupKey;
    @Nonnull
    private final ImmutableList<AggregateExpr> aggregates;

    public ReduceNode(int id, @Nonnull RelationNode input, @Nonnull List<? extends ScalarExpr> groupKey,
                      @Nonnull List<AggregateExpr> aggregates) {
        super(id, outputType(groupKey, aggregates));
        this.input = input;
        this.groupKey = ImmutableList.copyOf(groupKey);
        this.aggregates = ImmutableList.copyOf(aggregates);
    }

    @Nonnull
    private static RelationType outputType(@Nonnull List<? extends ScalarExpr> groupKey, @Nonnull List<AggregateExpr> aggregates) {
        RelationType type = RelationType.empty();
        for (ScalarExpr key : groupKey) {
            type = type.append(key.getType());
        }
        for (AggregateExpr aggregate : aggregates) {
            type = type.append(aggregate.getType());
        }
        return type;
    }

    @Nonnull
    public RelationNode getInput() {
        return input;
    }

    @Nonnull
    public ImmutableList<ScalarExpr> getGroupKey() {
        return groupKey;
    }

    @Nonnull
    public ImmutableList<AggregateExpr> getAggregates() {
        return aggregates;
    }

    public boolean isDistinct() {
        return aggregates.isEmpty();
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(input);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitReduce(this);
    }
}
