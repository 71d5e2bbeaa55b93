/*
 * JoinInputMapper.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Translates between the columns of a join's concatenated row and the columns of its individual inputs.
 */
@API(API.Status.INTERNAL)
public final class JoinInputMapper {
    @Nonnull
    private final ImmutableList<Integer> arities;
    @Nonnull
    private final int[] offsets;
    private final int totalArity;

    public JoinInputMapper(@Nonnull List<Integer> arities) {
        this.arities = ImmutableList.copyOf(arities);
        this.offsets = new int[arities.size()];
        int offset = 0;
        for (int i = 0; i < arities.size(); i++) {
            offsets[i] = offset;
            offset += arities.get(i);
        }
        this.totalArity = offset;
    }

    @Nonnull
    public static JoinInputMapper forInputs(@Nonnull List<? extends RelationNode> inputs) {
        final ImmutableList.Builder<Integer> arities = ImmutableList.builderWithExpectedSize(inputs.size());
        for (RelationNode input : inputs) {
            arities.add(input.getArity());
        }
        return new JoinInputMapper(arities.build());
    }

    public int getInputCount() {
        return arities.size();
    }

    public int getTotalArity() {
        return totalArity;
    }

    public int getArity(int input) {
        return arities.get(input);
    }

    /**
     * The input that produces a column of the concatenated row.
     * @param column a column of the concatenated row
     * @return the index of the input
     */
    public int inputOf(int column) {
        Preconditions.checkElementIndex(column, totalArity, "join column");
        int input = 0;
        while (input + 1 < offsets.length && offsets[input + 1] <= column) {
            input++;
        }
        return input;
    }

    public int localColumn(int column) {
        return column - offsets[inputOf(column)];
    }

    public int globalColumn(int input, int localColumn) {
        Preconditions.checkElementIndex(localColumn, arities.get(input), "input column");
        return offsets[input] + localColumn;
    }
}
