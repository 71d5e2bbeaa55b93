/*
 * ColumnOrder.java
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
import io.deltaplan.expr.ColumnExpr;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One element of a {@code TopK} ordering: a column and a direction. Nulls sort after all other values in
 * ascending order and before them in descending order.
 */
@API(API.Status.STABLE)
public final class ColumnOrder {
    private final int column;
    private final boolean descending;

    public ColumnOrder(int column, boolean descending) {
        this.column = column;
        this.descending = descending;
    }

    @Nonnull
    public static ColumnOrder ascending(int column) {
        return new ColumnOrder(column, false);
    }

    @Nonnull
    public static ColumnOrder descending(int column) {
        return new ColumnOrder(column, true);
    }

    public int getColumn() {
        return column;
    }

    public boolean isDescending() {
        return descending;
    }

    @Nonnull
    public String explain() {
        return ColumnExpr.explainColumn(column) + (descending ? " desc" : " asc");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnOrder)) {
            return false;
        }
        ColumnOrder that = (ColumnOrder)o;
        return column == that.column && descending == that.descending;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, descending);
    }

    @Override
    public String toString() {
        return explain();
    }
}
