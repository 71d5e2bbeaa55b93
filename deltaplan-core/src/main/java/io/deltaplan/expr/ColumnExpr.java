/*
 * ColumnExpr.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A reference to a column of the current row by zero-based position. Renders as {@code #n}.
 */
@API(API.Status.STABLE)
public final class ColumnExpr extends ScalarExpr {
    private final int column;

    public ColumnExpr(int column, @Nonnull ColumnType type) {
        super(type);
        Preconditions.checkArgument(column >= 0, "negative column reference");
        this.column = column;
    }

    public int getColumn() {
        return column;
    }

    @Override
    protected void collectSupport(@Nonnull ImmutableSortedSet.Builder<Integer> builder) {
        builder.add(column);
    }

    @Override
    public <T> T accept(@Nonnull ScalarExprVisitor<T> visitor) {
        return visitor.visitColumn(this);
    }

    @Nonnull
    @Override
    public String explain() {
        return explainColumn(column);
    }

    @Nonnull
    public static String explainColumn(int column) {
        return "#" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnExpr)) {
            return false;
        }
        ColumnExpr that = (ColumnExpr)o;
        return column == that.column && getType().equals(that.getType());
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, getType());
    }
}
