/*
 * SourceForm.java
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
import io.deltaplan.types.RelationType;

import javax.annotation.Nonnull;

/**
 * Declares a source relation by name and row type.
 */
@API(API.Status.STABLE)
public final class SourceForm implements TopLevelForm {
    @Nonnull
    private final String name;
    @Nonnull
    private final RelationType type;

    public SourceForm(@Nonnull String name, @Nonnull RelationType type) {
        this.name = name;
        this.type = type;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public RelationType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "defsource " + name + " " + type;
    }
}
