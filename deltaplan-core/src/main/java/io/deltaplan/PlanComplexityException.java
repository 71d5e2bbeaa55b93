/*
 * PlanComplexityException.java
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

package io.deltaplan;

import io.deltaplan.annotation.API;
import io.deltaplan.logging.LogMessageKeys;

/**
 * Exception thrown when a construction request would create more plan nodes than the configured limit.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public final class PlanComplexityException extends PlanCoreException {
    public PlanComplexityException(int threshold) {
        super("Plan exceeds complexity threshold", LogMessageKeys.COMPLEXITY_THRESHOLD, threshold);
    }
}
