/*
 * Arrangement.java
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
import io.deltaplan.plan.KeySet;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * One indexed materialization: a collection keyed by a key set, together with the nodes that use it.
 */
@API(API.Status.STABLE)
public final class Arrangement {
    @Nonnull
    private final CollectionId collection;
    @Nonnull
    private final KeySet key;
    @Nonnull
    private final ImmutableList<Integer> consumers;

    Arrangement(@Nonnull CollectionId collection, @Nonnull KeySet key, @Nonnull List<Integer> consumers) {
        this.collection = collection;
        this.key = key;
        this.consumers = ImmutableList.copyOf(consumers);
    }

    @Nonnull
    public CollectionId getCollection() {
        return collection;
    }

    @Nonnull
    public KeySet getKey() {
        return key;
    }

    /**
     * The identifiers of the nodes that requested this arrangement, in request order. A node that requested it
     * more than once is listed once.
     * @return the consumer node ids
     */
    @Nonnull
    public ImmutableList<Integer> getConsumers() {
        return consumers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arrangement)) {
            return false;
        }
        Arrangement that = (Arrangement)o;
        return collection.equals(that.collection) && key.equals(that.key) && consumers.equals(that.consumers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, key, consumers);
    }

    @Override
    public String toString() {
        return collection + key.explain() + " <- " + consumers;
    }
}
