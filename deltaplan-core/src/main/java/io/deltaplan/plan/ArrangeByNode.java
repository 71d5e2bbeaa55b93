/*
 * ArrangeByNode.java
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
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Requests that its input be materialized in indexed form under each of the given keys. The rows pass through
 * unchanged. The key sets are distinct and keep the order in which they were first requested.
 */
@API(API.Status.STABLE)
public final class ArrangeByNode extends RelationNode {
    @Nonnull
    private final RelationNode input;
    @Nonnull
    private final ImmutableList<KeySet> keys;

    public ArrangeByNode(int id, @Nonnull RelationNode input, @Nonnull List<KeySet> keys) {
        super(id, input.getType());
        this.input = input;
        // ImmutableSet keeps first-insertion order
        this.keys = ImmutableSet.copyOf(keys).asList();
    }

    @Nonnull
    public RelationNode getInput() {
        return input;
    }

    @Nonnull
    public ImmutableList<KeySet> getKeys() {
        return keys;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of(input);
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitArrangeBy(this);
    }
}
