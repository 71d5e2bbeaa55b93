/*
 * MapNode.java
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
import io.deltaplan.expr.ScalarExpr;
import io.deltaplan.types.RelationType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Appends one column per scalar expression to each input row. Expression {@code k} may read the input columns
 * and the columns produced by expressions {@code 0} through {@code k - 1}.
 */
@API(API.Status.STABLE)
public final class MapNode extends RelationNode {
    @Nonnull
    private final RelationNode input;
    @Nonnull
    private final ImmutableList<ScalarExpr> scalars;

    public MapNode(int id, @Nonnull RelationNode input, @Nonnull List<? extends ScalarExpr> scalars) {
        super(id, outputType(input, scalars));
        this.input = input;
        this.scalars = ImmutableList.copyOf(scalars);
    }

    @Nonnull
    private static RelationType outputType(@Nonnull RelationNode input, @Nonnull List<? extends ScalarExpr> scalars) {
        RelationType type = input.getType();
        for (ScalarExpr scalar : scalars) {
            type = type.append(scalar.getType());
        }
        return type;
    }

    @Nonnull
    public RelationNode getInput() {
        return input;
    }

    @Nonnull
    public ImmutableList<ScalarExpr> getScalars() {
        return scalars;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(input);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitMap(this);
    }
}
