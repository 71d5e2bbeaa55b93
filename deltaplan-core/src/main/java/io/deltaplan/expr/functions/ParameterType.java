/*
 * ParameterType.java
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

package io.deltaplan.expr.functions;

import io.deltaplan.annotation.API;
import io.deltaplan.types.ScalarType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The type a function parameter accepts: one exact scalar type, any numeric type, or any type at all.
 */
@API(API.Status.EXPERIMENTAL)
public final class ParameterType {
    private static final ParameterType ANY = new ParameterType(null, false);
    private static final ParameterType ANY_NUMERIC = new ParameterType(null, true);

    @Nullable
    private final ScalarType scalarType;
    private final boolean numericOnly;

    private ParameterType(@Nullable ScalarType scalarType, boolean numericOnly) {
        this.scalarType = scalarType;
        this.numericOnly = numericOnly;
    }

    @Nonnull
    public static ParameterType any() {
        return ANY;
    }

    @Nonnull
    public static ParameterType anyNumeric() {
        return ANY_NUMERIC;
    }

    @Nonnull
    public static ParameterType of(@Nonnull ScalarType scalarType) {
        return new ParameterType(scalarType, false);
    }

    public boolean accepts(@Nonnull ScalarType argumentType) {
        if (scalarType != null) {
            return scalarType == argumentType;
        }
        return !numericOnly || argumentType.isNumeric();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParameterType)) {
            return false;
        }
        ParameterType that = (ParameterType)o;
        return numericOnly == that.numericOnly && scalarType == that.scalarType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalarType, numericOnly);
    }

    @Override
    public String toString() {
        if (scalarType != null) {
            return scalarType.toString();
        }
        return numericOnly ? "numeric*" : "any";
    }
}
