/*
 * AggregateForm.java
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

package io.deltaplan.plan.construction;

import io.deltaplan.annotation.API;

import javax.annotation.Nonnull;

/**
 * An unvalidated aggregate of a reduce form: function name, input column and distinct flag.
 */
@API(API.Status.STABLE)
public final class AggregateForm {
    @Nonnull
    private final String functionName;
    private final int column;
    private final boolean distinct;

    public AggregateForm(@Nonnull String functionName, int column, boolean distinct) {
        this.functionName = functionName;
        this.column = column;
        this.distinct = distinct;
    }

    @Nonnull
    public static AggregateForm of(@Nonnull String functionName, int column) {
        return new AggregateForm(functionName, column, false);
    }

    @Nonnull
    public static AggregateForm distinct(@Nonnull String functionName, int column) {
        return new AggregateForm(functionName, column, true);
    }

    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    public int getColumn() {
        return column;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public String toString() {
        return "(" + functionName + " #" + column + (distinct ? " distinct)" : ")");
    }
}
