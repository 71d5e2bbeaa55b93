/*
 * KeySet.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered list of columns an arrangement is keyed by. Repeated columns are kept as written.
 */
@API(API.Status.STABLE)
public final class KeySet {
    @Nonnull
    private final ImmutableList<Integer> columns;

    private KeySet(@Nonnull ImmutableList<Integer> columns) {
        this.columns = columns;
    }

    @Nonnull
    public static KeySet of(@Nonnull List<Integer> columns) {
        return new KeySet(ImmutableList.copyOf(columns));
    }

    @Nonnull
    public static KeySet of(@Nonnull Integer... columns) {
        return new KeySet(ImmutableList.copyOf(columns));
    }

    @Nonnull
    public ImmutableList<Integer> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Render as {@code (#0, #1)}.
     * @return the rendered key
     */
    @Nonnull
    public String explain() {
        return columns.stream().map(ColumnExpr::explainColumn).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof KeySet && columns.equals(((KeySet)o).columns));
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return explain();
    }
}
