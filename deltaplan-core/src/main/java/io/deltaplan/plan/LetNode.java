/*
 * LetNode.java
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

/**
 * Binds a name to a value sub-plan that the body may read any number of times through {@link GetNode}s.
 * The value is stored once. The node produces the rows of its body.
 */
@API(API.Status.STABLE)
public final class LetNode extends RelationNode {
    @Nonnull
    private final LocalId localId;
    @Nonnull
    private final String name;
    @Nonnull
    private final RelationNode value;
    @Nonnull
    private final RelationNode body;

    public LetNode(int id, @Nonnull LocalId localId, @Nonnull String name, @Nonnull RelationNode value, @Nonnull RelationNode body) {
        super(id, body.getType());
        this.localId = localId;
        this.name = name;
        this.value = value;
        this.body = body;
    }

    @Nonnull
    public LocalId getLocalId() {
        return localId;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public RelationNode getValue() {
        return value;
    }

    @Nonnull
    public RelationNode getBody() {
        return body;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(value, body);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitLet(this);
    }
}
