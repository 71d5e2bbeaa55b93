/*
 * ScalarType.java
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
import java.util.Optional;

/**
 * The scalar types a column or expression can have.
 */
@API(API.Status.STABLE)
public enum ScalarType {
    BOOL("bool"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    FLOAT32("float32"),
    FLOAT64("float64"),
    NUMERIC("numeric"),
    STRING("string"),
    DATE("date"),
    TIMESTAMP("timestamp");

    @Nonnull
    private final String typeName;

    ScalarType(@Nonnull String typeName) {
        this.typeName = typeName;
    }

    @Nonnull
    public String getTypeName() {
        return typeName;
    }

    public boolean isInteger() {
        return this == INT16 || this == INT32 || this == INT64;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloatingPoint() || this == NUMERIC;
    }

    @Nonnull
    public static Optional<ScalarType> forName(@Nonnull String typeName) {
        for (ScalarType type : values()) {
            if (type.typeName.equals(typeName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return typeName;
    }
}
