/*
 * BinaryOperatorFunction.java
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

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A binary function rendered infix as {@code (left op right)}.
 */
public abstract class BinaryOperatorFunction extends BuiltInFunction {
    @Nonnull
    private final String operator;

    protected BinaryOperatorFunction(@Nonnull String functionName, @Nonnull String operator, @Nonnull ParameterType operandType) {
        super(functionName, ImmutableList.of(operandType, operandType));
        this.operator = operator;
    }

    @Nonnull
    public String getOperator() {
        return operator;
    }

    @Nonnull
    @Override
    public String getDisplayName() {
        return operator;
    }

    @Nonnull
    @Override
    public String explain(@Nonnull List<String> renderedArguments) {
        return "(" + renderedArguments.get(0) + " " + operator + " " + renderedArguments.get(1) + ")";
    }
}
