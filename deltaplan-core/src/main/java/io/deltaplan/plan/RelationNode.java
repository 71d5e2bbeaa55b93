/*
 * RelationNode.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;

/**
 * One operator of a plan graph. Nodes are created by plan construction and are immutable. Each node has an
 * identifier that is unique within its {@link PlanGraph} and is assigned in construction order, so the inputs
 * of a node always have smaller identifiers than the node itself.
 *
 * <p>
 * The set of node kinds is closed: {@link ConstantNode}, {@link GetNode}, {@link LetNode}, {@link MapNode},
 * {@link FilterNode}, {@link ArrangeByNode}, {@link JoinNode}, {@link ReduceNode} and {@link TopKNode}.
 * Consumers branch over them with a {@link RelationNodeVisitor}, which has one method per kind.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class RelationNode {
    private final int id;
    @Nonnull
    private final RelationType type;

    protected RelationNode(int id, @Nonnull RelationType type) {
        this.id = id;
        this.type = type;
    }

    public int getId() {
        return id;
    }

    /**
     * The column types of the rows this node produces.
     * @return the output relation type
     */
    @Nonnull
    public RelationType getType() {
        return type;
    }

    public int getArity() {
        return type.getArity();
    }

    /**
     * The nodes this node owns as inputs, in positional order. A {@link GetNode} has no inputs; the value it
     * names is owned by its {@link LetNode}.
     * @return the inputs
     */
    @Nonnull
    public abstract ImmutableList<RelationNode> getInputs();

    public abstract <T> T accept(@Nonnull RelationNodeVisitor<T> visitor);

    /**
     * A short name for this kind of node, used in log messages.
     * @return the node kind
     */
    @Nonnull
    public String getKind() {
        final String simpleName = getClass().getSimpleName();
        return simpleName.endsWith("Node") ? simpleName.substring(0, simpleName.length() - 4) : simpleName;
    }

    @Override
    public String toString() {
        return getKind() + "#" + id;
    }
}
