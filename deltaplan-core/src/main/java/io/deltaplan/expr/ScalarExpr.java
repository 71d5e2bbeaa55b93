/*
 * ScalarExpr.java
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

package io.deltaplan.expr;

import io.deltaplan.annotation.API;
import io.deltaplan.types.ColumnType;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;

/**
 * A validated scalar expression evaluated against one row of a relation. Instances are created by plan
 * construction, which checks column references against the arity of the row and types every sub-expression,
 * so every expression knows its own {@link ColumnType}.
 *
 * <p>
 * The variants are {@link LiteralExpr}, {@link ColumnExpr} and {@link CallExpr}. Consumers branch over them with
 * a {@link ScalarExprVisitor}.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class ScalarExpr {
    @Nonnull
    private final ColumnType type;

    protected ScalarExpr(@Nonnull ColumnType type) {
        this.type = type;
    }

    @Nonnull
    public ColumnType getType() {
        return type;
    }

    /**
     * The columns of the input row this expression reads.
     * @return the referenced columns in ascending order
     */
    @Nonnull
    public ImmutableSortedSet<Integer> getSupport() {
        final ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        collectSupport(builder);
        return builder.build();
    }

    protected abstract void collectSupport(@Nonnull ImmutableSortedSet.Builder<Integer> builder);

    public abstract <T> T accept(@Nonnull ScalarExprVisitor<T> visitor);

    /**
     * Render this expression as it appears in explain output.
     * @return the rendered expression
     */
    @Nonnull
    public abstract String explain();

    @Override
    public String toString() {
        return explain();
    }
}
