/*
 * ConstantNode.java
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
import io.deltaplan.types.Datum;
import io.deltaplan.types.RelationType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A literal set of rows. Rows may repeat; the node describes a multiset.
 */
@API(API.Status.STABLE)
public final class ConstantNode extends RelationNode {
    @Nonnull
    private final ImmutableList<ImmutableList<Datum>> rows;

    public ConstantNode(int id, @Nonnull RelationType type, @Nonnull List<? extends List<Datum>> rows) {
        super(id, type);
        final ImmutableList.Builder<ImmutableList<Datum>> builder = ImmutableList.builderWithExpectedSize(rows.size());
        for (List<Datum> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    @Nonnull
    public ImmutableList<ImmutableList<Datum>> getRows() {
        return rows;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of();
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }
}
