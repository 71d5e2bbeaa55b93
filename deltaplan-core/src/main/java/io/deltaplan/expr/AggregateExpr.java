/*
 * AggregateExpr.java
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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One aggregate of a {@code Reduce}: a function applied to the multiset of values of one input column within
 * a group, de-duplicated first when {@link #isDistinct()} is set.
 */
@API(API.Status.STABLE)
public final class AggregateExpr {
    @Nonnull
    private final AggregateFunction function;
    private final int column;
    private final boolean distinct;
    @Nonnull
    private final ColumnType type;

    public AggregateExpr(@Nonnull AggregateFunction function, int column, boolean distinct, @Nonnull ColumnType type) {
        this.function = function;
        this.column = column;
        this.distinct = distinct;
        this.type = type;
    }

    @Nonnull
    public AggregateFunction getFunction() {
        return function;
    }

    public int getColumn() {
        return column;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Nonnull
    public ColumnType getType() {
        return type;
    }

    /**
     * Render as {@code sum(#1)} or {@code count(distinct #2)}.
     * @return the rendered aggregate
     */
    @Nonnull
    public String explain() {
        return function.getFunctionName() + "(" + (distinct ? "distinct " : "") + ColumnExpr.explainColumn(column) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateExpr)) {
            return false;
        }
        AggregateExpr that = (AggregateExpr)o;
        return column == that.column && distinct == that.distinct && function == that.function;
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, column, distinct);
    }

    @Override
    public String toString() {
        return explain();
    }
}
