/*
 * CollectionId.java
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

package io.deltaplan.plan.planning;

import io.deltaplan.annotation.API;
import io.deltaplan.plan.ArrangeByNode;
import io.deltaplan.plan.GetNode;
import io.deltaplan.plan.LetNode;
import io.deltaplan.plan.LocalId;
import io.deltaplan.plan.RelationNode;
import io.deltaplan.plan.SourceDefinition;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Function;

/**
 * Identifies the collection of rows an arrangement indexes. Every read of the same source is one collection,
 * every read of a binding is the collection of the binding's value, and any other node is a collection of its own.
 */
@API(API.Status.STABLE)
public final class CollectionId {
    /**
     * What a collection is.
     */
    public enum Kind {
        SOURCE,
        NODE
    }

    @Nonnull
    private final Kind kind;
    private final int index;

    private CollectionId(@Nonnull Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    @Nonnull
    public static CollectionId ofSource(@Nonnull SourceDefinition source) {
        return new CollectionId(Kind.SOURCE, source.getIndex());
    }

    @Nonnull
    public static CollectionId ofNode(int nodeId) {
        return new CollectionId(Kind.NODE, nodeId);
    }

    /**
     * The collection a node's rows belong to for the purpose of sharing arrangements. Reads of a source map to that
     * source, reads of a binding map to the collection of the binding's value, and {@code ArrangeBy} and {@code Let}
     * map to the collection of the rows they pass through.
     * @param node a plan node
     * @param bindingCollections the collection of each binding's value, for the bindings {@code node} can read
     * @return the collection
     */
    @Nonnull
    public static CollectionId of(@Nonnull RelationNode node,
                                  @Nonnull Function<LocalId, CollectionId> bindingCollections) {
        if (node instanceof GetNode) {
            final GetNode get = (GetNode)node;
            final SourceDefinition source = get.getSource();
            if (source != null) {
                return ofSource(source);
            }
            return Objects.requireNonNull(bindingCollections.apply(Objects.requireNonNull(get.getLocalId())),
                    "binding read before its value was built");
        }
        if (node instanceof ArrangeByNode) {
            return of(((ArrangeByNode)node).getInput(), bindingCollections);
        }
        if (node instanceof LetNode) {
            return of(((LetNode)node).getBody(), bindingCollections);
        }
        return ofNode(node.getId());
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * The source index or node id, depending on {@link #getKind()}.
     * @return the index
     */
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CollectionId)) {
            return false;
        }
        CollectionId that = (CollectionId)o;
        return index == that.index && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SOURCE:
                return "u" + index;
            default:
                return "node" + index;
        }
    }
}
