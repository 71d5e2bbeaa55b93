/*
 * LiteralExpr.java
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
import io.deltaplan.types.Datum;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;

/**
 * A constant value. A literal is nullable exactly when its value is SQL null.
 */
@API(API.Status.STABLE)
public final class LiteralExpr extends ScalarExpr {
    @Nonnull
    private final Datum datum;

    public LiteralExpr(@Nonnull Datum datum) {
        super(ColumnType.of(datum.getType(), datum.isNull()));
        this.datum = datum;
    }

    @Nonnull
    public Datum getDatum() {
        return datum;
    }

    @Override
    protected void collectSupport(@Nonnull ImmutableSortedSet.Builder<Integer> builder) {
        // a literal reads no columns
    }

    @Override
    public <T> T accept(@Nonnull ScalarExprVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Nonnull
    @Override
    public String explain() {
        return datum.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LiteralExpr && datum.equals(((LiteralExpr)o).datum));
    }

    @Override
    public int hashCode() {
        return datum.hashCode();
    }
}
