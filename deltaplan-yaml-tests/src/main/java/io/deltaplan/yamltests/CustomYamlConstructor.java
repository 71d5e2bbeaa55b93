/*
 * CustomYamlConstructor.java
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

package io.deltaplan.yamltests;

import com.google.common.collect.ImmutableSet;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * Safe YAML constructor that remembers the line numbers of the keys that start blocks and plan commands, so that
 * failures can point back into the test file.
 */
public class CustomYamlConstructor extends SafeConstructor {

    private static final Set<String> REQUIRE_LINE_NUMBER = ImmutableSet.of(
            Block.ConfigBlock.CONFIG_BLOCK,
            Block.TestBlock.TEST_BLOCK,
            PlanCommand.PLAN);

    public CustomYamlConstructor(@Nonnull LoaderOptions loaderOptions) {
        super(loaderOptions);
    }

    @Override
    protected Object constructObject(Node node) {
        if (node instanceof ScalarNode && REQUIRE_LINE_NUMBER.contains(((ScalarNode)node).getValue())) {
            return new LinedObject(super.constructObject(node), node.getStartMark().getLine() + 1);
        }
        return super.constructObject(node);
    }

    /**
     * A key together with the (1-based) line it was read from.
     */
    public static final class LinedObject {
        @Nonnull
        private final Object object;
        private final int lineNumber;

        private LinedObject(@Nonnull Object object, int lineNumber) {
            this.object = object;
            this.lineNumber = lineNumber;
        }

        @Nonnull
        public Object getObject() {
            return object;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        @Override
        public String toString() {
            return object + "@" + lineNumber;
        }
    }
}
