/*
 * SourceDefinition.java
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
import io.deltaplan.types.RelationType;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A named input relation declared to plan construction. Sources are numbered in declaration order and render
 * as {@code u<k>}.
 */
@API(API.Status.STABLE)
public final class SourceDefinition {
    @Nonnull
    private final String name;
    private final int index;
    @Nonnull
    private final RelationType type;

    public SourceDefinition(@Nonnull String name, int index, @Nonnull RelationType type) {
        this.name = name;
        this.index = index;
        this.type = type;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    @Nonnull
    public String getSourceId() {
        return "u" + index;
    }

    @Nonnull
    public RelationType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceDefinition)) {
            return false;
        }
        SourceDefinition that = (SourceDefinition)o;
        return index == that.index && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, type);
    }

    @Override
    public String toString() {
        return name + " (" + getSourceId() + ") " + type;
    }
}
