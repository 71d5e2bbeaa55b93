/*
 * TopKNode.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.OptionalLong;

/**
 * Keeps, for each group of input rows sharing the group columns, the rows at positions
 * {@code [offset, offset + limit)} of the group sorted by the order columns. Without a limit all rows from
 * {@code offset} on are kept.
 *
 * <p>
 * Rows that compare equal under the ordering have no defined relative order, so which of several tied rows
 * survive a cut is unspecified.
 * </p>
 */
@API(API.Status.STABLE)
public final class TopKNode extends RelationNode {
    @Nonnull
    private final RelationNode input;
    @Nonnull
    private final ImmutableList<Integer> groupKey;
    @Nonnull
    private final ImmutableList<ColumnOrder> order;
    @Nonnull
    private final OptionalLong limit;
    private final long offset;

    public TopKNode(int id, @Nonnull RelationNode input, @Nonnull List<Integer> groupKey, @Nonnull List<ColumnOrder> order,
                    @Nonnull OptionalLong limit, long offset) {
        super(id, input.getType());
        this.input = input;
        this.groupKey = ImmutableList.copyOf(groupKey);
        this.order = ImmutableList.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    @Nonnull
    public RelationNode getInput() {
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

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(input);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitTopK(this);
    }
}
