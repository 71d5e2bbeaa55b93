/*
 * GetNode.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A read of a source or of a {@link LetNode} binding. The referent is held by identifier, not by reference:
 * the value of a binding is owned by its {@code Let} and is looked up through {@link PlanGraph#getBinding(LocalId)}.
 */
@API(API.Status.STABLE)
public final class GetNode extends RelationNode {
    @Nonnull
    private final String name;
    @Nullable
    private final SourceDefinition source;
    @Nullable
    private final LocalId localId;

    private GetNode(int id, @Nonnull RelationType type, @Nonnull String name,
                    @Nullable SourceDefinition source, @Nullable LocalId localId) {
        super(id, type);
        Preconditions.checkArgument((source == null) != (localId == null), "get must name exactly one referent");
        this.name = name;
        this.source = source;
        this.localId = localId;
    }

    @Nonnull
    public static GetNode ofSource(int id, @Nonnull SourceDefinition source) {
        return new GetNode(id, source.getType(), source.getName(), source, null);
    }

    @Nonnull
    public static GetNode ofLocal(int id, @Nonnull String name, @Nonnull LocalId localId, @Nonnull RelationType type) {
        return new GetNode(id, type, name, null, localId);
    }

    /**
     * The name the reference was written with.
     * @return the referenced name
     */
    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isSource() {
        return source != null;
    }

    @Nullable
    public SourceDefinition getSource() {
        return source;
    }

    @Nullable
    public LocalId getLocalId() {
        return localId;
    }

    @Nonnull
    @Override
    public ImmutableList<RelationNode> getInputs() {
        return ImmutableList.of();
    }

    @Override
    public <T> T accept(@Nonnull RelationNodeVisitor<T> visitor) {
        return visitor.visitGet(this);
    }
}
