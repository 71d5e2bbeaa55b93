/*
 * CallExpr.java
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
import io.deltaplan.expr.functions.BuiltInFunction;
import io.deltaplan.types.ColumnType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * An application of a {@link BuiltInFunction} to an ordered list of argument expressions.
 */
@API(API.Status.STABLE)
public final class CallExpr extends ScalarExpr {
    @Nonnull
    private final BuiltInFunction function;
    @Nonnull
    private final ImmutableList<ScalarExpr> arguments;

    public CallExpr(@Nonnull BuiltInFunction function, @Nonnull List<? extends ScalarExpr> arguments, @Nonnull ColumnType type) {
        super(type);
        this.function = function;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Nonnull
    public BuiltInFunction getFunction() {
        return function;
    }

    @Nonnull
    public ImmutableList<ScalarExpr> getArguments() {
        return arguments;
    }

    @Override
    protected void collectSupport(@Nonnull ImmutableSortedSet.Builder<Integer> builder) {
        for (ScalarExpr argument : arguments) {
            argument.collectSupport(builder);
        }
    }

    @Override
    public <T> T accept(@Nonnull ScalarExprVisitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Nonnull
    @Override
    public String explain() {
        final ImmutableList.Builder<String> rendered = ImmutableList.builderWithExpectedSize(arguments.size());
        for (ScalarExpr argument : arguments) {
            rendered.add(argument.explain());
        }
        return function.explain(rendered.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallExpr)) {
            return false;
        }
        CallExpr that = (CallExpr)o;
        return function.getFunctionName().equals(that.function.getFunctionName()) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function.getFunctionName(), arguments);
    }
}
