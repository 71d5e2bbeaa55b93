/*
 * DeltaStep.java
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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One step of a {@link DeltaRule}: probe the arrangement of input {@link #getInput()} keyed by
 * {@link #getKey()}. Key columns are numbered locally to the probed input.
 */
@API(API.Status.STABLE)
public final class DeltaStep {
    private final int input;
    @Nonnull
    private final KeySet key;

    public DeltaStep(int input, @Nonnull KeySet key) {
        this.input = input;
        this.key = key;
    }

    public int getInput() {
        return input;
    }

    @Nonnull
    public KeySet getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeltaStep)) {
            return false;
        }
        DeltaStep that = (DeltaStep)o;
        return input == that.input && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, key);
    }

    @Override
    public String toString() {
        return input + "." + key;
    }
}
