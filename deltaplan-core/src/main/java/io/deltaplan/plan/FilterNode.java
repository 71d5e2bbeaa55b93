/*
 * FilterNode.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Keeps the input rows for which every predicate is true. Rows for which a predicate is false or null are dropped.
 */
@API(API.Status.STABLE)
public final class FilterNode extends RelationNode {
    @Nonnull
    private final RelationNode input;
    @Nonnull
    private final ImmutableList<ScalarExpr> predicates;

    public FilterNode(int id, @Nonnull RelationNode input, @Nonnull List<? extends ScalarExpr> predicates) {
        super(id, input.getType());
        this.input = input;
        this.predicates = ImmutableList.copyOf(predicates);
    }

    @Nonnull
    public RelationNode getInput() {
        return input;
    }

    @Nonnull
    public ImmutableList<ScalarExpr> getPredicates() {
        return predicates;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(input);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitFilter(this);
    }
}
