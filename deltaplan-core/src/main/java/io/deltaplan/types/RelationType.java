/*
 * RelationType.java
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

package io.deltaplan.types;

import io.deltaplan.annotation.API;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The row schema of a relation: an ordered list of column types. The arity of a relation is the number of columns.
 */
@API(API.Status.STABLE)
public final class RelationType {
    private static final RelationType EMPTY = new RelationType(ImmutableList.of());

    @Nonnull
    private final ImmutableList<ColumnType> columnTypes;

    private RelationType(@Nonnull ImmutableList<ColumnType> columnTypes) {
        this.columnTypes = columnTypes;
    }

    @Nonnull
    public static RelationType empty() {
        return EMPTY;
    }

    @Nonnull
    public static RelationType of(@Nonnull List<ColumnType> columnTypes) {
        return new RelationType(ImmutableList.copyOf(columnTypes));
    }

    @Nonnull
    public static RelationType of(@Nonnull ColumnType... columnTypes) {
        return new RelationType(ImmutableList.copyOf(columnTypes));
    }

    /**
     * Relation type whose columns are all non-nullable and of the given scalar types.
     * @param scalarTypes the column types in order
     * @return the relation type
     */
    @Nonnull
    public static RelationType ofScalars(@Nonnull ScalarType... scalarTypes) {
        final ImmutableList.Builder<ColumnType> builder = ImmutableList.builder();
        for (ScalarType scalarType : scalarTypes) {
            builder.add(ColumnType.of(scalarType));
        }
        return new RelationType(builder.build());
    }

    @Nonnull
    public ImmutableList<ColumnType> getColumnTypes() {
        return columnTypes;
    }

    public int getArity() {
        return columnTypes.size();
    }

    @Nonnull
    public ColumnType getColumnType(int column) {
        Preconditions.checkElementIndex(column, columnTypes.size(), "column");
        return columnTypes.get(column);
    }

    @Nonnull
    public RelationType concat(@Nonnull RelationType other) {
        return new RelationType(ImmutableList.<ColumnType>builder().addAll(columnTypes).addAll(other.columnTypes).build());
    }

    @Nonnull
    public RelationType append(@Nonnull ColumnType columnType) {
        return new RelationType(ImmutableList.<ColumnType>builder().addAll(columnTypes).add(columnType).build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelationType)) {
            return false;
        }
        return columnTypes.equals(((RelationType)o).columnTypes);
    }

    @Override
    public int hashCode() {
        return columnTypes.hashCode();
    }

    @Override
    public String toString() {
        return columnTypes.stream().map(ColumnType::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
