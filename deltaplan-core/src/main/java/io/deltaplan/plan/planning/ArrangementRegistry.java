/*
 * ArrangementRegistry.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The arrangements requested while constructing one plan graph. Requests for the same key set on the same
 * collection share one entry, which records every consumer.
 *
 * <p>
 * A registry is filled through its {@link Builder} during construction and is immutable afterwards.
 * Arrangements are listed in the order they were first requested.
 * </p>
 */
@API(API.Status.STABLE)
public final class ArrangementRegistry {
    @Nonnull
    private final ImmutableMap<ArrangementKey, Arrangement> arrangements;

    private ArrangementRegistry(@Nonnull ImmutableMap<ArrangementKey, Arrangement> arrangements) {
        this.arrangements = arrangements;
    }

    @Nonnull
    public static ArrangementRegistry empty() {
        return new ArrangementRegistry(ImmutableMap.of());
    }

    @Nonnull
    public ImmutableList<Arrangement> getArrangements() {
        return arrangements.values().asList();
    }

    /**
     * The arrangements of one collection.
     * @param collection the collection
     * @return its arrangements in request order
     */
    @Nonnull
    public ImmutableList<Arrangement> getArrangements(@Nonnull CollectionId collection) {
        final ImmutableList.Builder<Arrangement> builder = ImmutableList.builder();
        for (Arrangement arrangement : arrangements.values()) {
            if (arrangement.getCollection().equals(collection)) {
                builder.add(arrangement);
            }
        }
        return builder.build();
    }

    @Nonnull
    public Optional<Arrangement> find(@Nonnull CollectionId collection, @Nonnull KeySet key) {
        return Optional.ofNullable(arrangements.get(new ArrangementKey(collection, key)));
    }

    public int size() {
        return arrangements.size();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return arrangements.values().toString();
    }

    /**
     * Collects arrangement requests during construction. Not thread safe.
     */
    public static final class Builder {
        // insertion ordered
        @Nonnull
        private final Map<ArrangementKey, List<Integer>> requests = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Record that a node needs the given collection arranged by the given key.
         * @param collection the collection to arrange
         * @param key the key set
         * @param consumerNodeId the id of the requesting node
         * @return whether this created a new arrangement rather than reusing an existing one
         */
        public boolean request(@Nonnull CollectionId collection, @Nonnull KeySet key, int consumerNodeId) {
            Preconditions.checkState(!built, "arrangement registry is frozen");
            final ArrangementKey arrangementKey = new ArrangementKey(collection, key);
            final List<Integer> consumers = requests.get(arrangementKey);
            if (consumers == null) {
                final List<Integer> newConsumers = new ArrayList<>();
                newConsumers.add(consumerNodeId);
                requests.put(arrangementKey, newConsumers);
                return true;
            }
            if (!consumers.contains(consumerNodeId)) {
                consumers.add(consumerNodeId);
            }
            return false;
        }

        public boolean contains(@Nonnull CollectionId collection, @Nonnull KeySet key) {
            return requests.containsKey(new ArrangementKey(collection, key));
        }

        @Nonnull
        public ArrangementRegistry build() {
            built = true;
            final ImmutableMap.Builder<ArrangementKey, Arrangement> builder = ImmutableMap.builderWithExpectedSize(requests.size());
            for (Map.Entry<ArrangementKey, List<Integer>> entry : requests.entrySet()) {
                final ArrangementKey arrangementKey = entry.getKey();
                builder.put(arrangementKey, new Arrangement(arrangementKey.collection, arrangementKey.key, entry.getValue()));
            }
            return new ArrangementRegistry(builder.build());
        }
    }

    private static final class ArrangementKey {
        @Nonnull
        private final CollectionId collection;
        @Nonnull
        private final KeySet key;

        ArrangementKey(@Nonnull CollectionId collection, @Nonnull KeySet key) {
            this.collection = collection;
            this.key = key;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ArrangementKey)) {
                return false;
            }
            ArrangementKey that = (ArrangementKey)o;
            return collection.equals(that.collection) && key.equals(that.key);
        }

        @Override
        public int hashCode() {
            return 31 * collection.hashCode() + key.hashCode();
        }
    }
}
