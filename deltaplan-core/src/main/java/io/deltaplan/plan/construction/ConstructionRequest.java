/*
 * ConstructionRequest.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * An ordered sequence of source declarations and relational expressions. Each relational expression becomes
 * one result of the plan graph. A source is visible to the forms after its declaration.
 */
@API(API.Status.STABLE)
public final class ConstructionRequest {
    @Nonnull
    private final ImmutableList<TopLevelForm> forms;

    private ConstructionRequest(@Nonnull ImmutableList<TopLevelForm> forms) {
        this.forms = forms;
    }

    @Nonnull
    public static ConstructionRequest of(@Nonnull List<? extends TopLevelForm> forms) {
        return new ConstructionRequest(ImmutableList.copyOf(forms));
    }

    @Nonnull
    public ImmutableList<TopLevelForm> getForms() {
        return forms;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return forms.toString();
    }

    /**
     * Builder for {@link ConstructionRequest}; forms keep the order they are added in.
     */
    public static final class Builder {
        @Nonnull
        private final ImmutableList.Builder<TopLevelForm> forms = ImmutableList.builder();

        private Builder() {
        }

        @Nonnull
        public Builder addSource(@Nonnull String name, @Nonnull RelationType type) {
            forms.add(new SourceForm(name, type));
            return this;
        }

        @Nonnull
        public Builder addResult(@Nonnull RelationForm form) {
            forms.add(form);
            return this;
        }

        @Nonnull
        public Builder add(@Nonnull TopLevelForm form) {
            forms.add(form);
            return this;
        }

        @Nonnull
        public ConstructionRequest build() {
            return new ConstructionRequest(forms.build());
        }
    }
}
