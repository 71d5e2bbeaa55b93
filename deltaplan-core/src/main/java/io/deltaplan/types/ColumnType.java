/*
 * ColumnType.java
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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The type of one column: a scalar type and whether the column may hold SQL {@code null}.
 */
@API(API.Status.STABLE)
public final class ColumnType {
    @Nonnull
    private final ScalarType scalarType;
    private final boolean nullable;

    private ColumnType(@Nonnull ScalarType scalarType, boolean nullable) {
        this.scalarType = scalarType;
        this.nullable = nullable;
    }

    @Nonnull
    public static ColumnType of(@Nonnull ScalarType scalarType) {
        return new ColumnType(scalarType, false);
    }

    @Nonnull
    public static ColumnType nullable(@Nonnull ScalarType scalarType) {
        return new ColumnType(scalarType, true);
    }

    @Nonnull
    public static ColumnType of(@Nonnull ScalarType scalarType, boolean nullable) {
        return new ColumnType(scalarType, nullable);
    }

    @Nonnull
    public ScalarType getScalarType() {
        return scalarType;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Nonnull
    public ColumnType withNullable(boolean newNullable) {
        return newNullable == nullable ? this : new ColumnType(scalarType, newNullable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnType)) {
            return false;
        }
        ColumnType that = (ColumnType)o;
        return nullable == that.nullable && scalarType == that.scalarType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalarType, nullable);
    }

    @Override
    public String toString() {
        return nullable ? scalarType + "?" : scalarType.toString();
    }
}
