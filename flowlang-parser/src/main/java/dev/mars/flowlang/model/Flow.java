/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowlang.model;

import dev.mars.flowlang.value.SourcePosition;

import java.util.List;

/**
 * A named, ordered program of steps. The name is the key under which the flow
 * is stored in {@link FlowDocument#flows()}.
 *
 * @param steps         the steps in source order
 * @param rejectedSteps number of steps, at any depth, dropped because they could not be parsed
 * @param position      position of the flow's step sequence, may be null
 */
public record Flow(List<Step> steps, int rejectedSteps, SourcePosition position) {

    public Flow {
        steps = List.copyOf(steps);
        if (rejectedSteps < 0) {
            throw new IllegalArgumentException("Rejected step count cannot be negative");
        }
    }

    /**
     * @return true if every step of the flow was parsed
     */
    public boolean isComplete() {
        return rejectedSteps == 0;
    }

    public int size() {
        return steps.size();
    }
}
