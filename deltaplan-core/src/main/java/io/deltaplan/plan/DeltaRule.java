/*
 * DeltaRule.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * How a join is updated when one of its inputs changes: the changes of {@link #getChangedInput()} are joined
 * against the other inputs in the order of {@link #getSteps()}.
 */
@API(API.Status.STABLE)
public final class DeltaRule {
    private final int changedInput;
    @Nonnull
    private final ImmutableList<DeltaStep> steps;

    public DeltaRule(int changedInput, @Nonnull List<DeltaStep> steps) {
        this.changedInput = changedInput;
        this.steps = ImmutableList.copyOf(steps);
    }

    public int getChangedInput() {
        return changedInput;
    }

    @Nonnull
    public ImmutableList<DeltaStep> getSteps() {
        return steps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeltaRule)) {
            return false;
        }
        DeltaRule that = (DeltaRule)o;
        return changedInput == that.changedInput && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changedInput, steps);
    }

    @Override
    public String toString() {
        return "delta " + changedInput + " " + steps;
    }
}
