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

package dev.mars.flowlang.parser;

import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Maps every {@link StepKind} to the builder of its variant.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
final class StepBuilderRegistry {
    private static final Logger logger = Logger.getLogger(StepBuilderRegistry.class.getName());

    private final Map<StepKind, StepBuilder> builders = new EnumMap<>(StepKind.class);

    StepBuilderRegistry() {
        registerDefaultBuilders();
    }

    private void registerDefaultBuilders() {
        registerBuilder(new ScalarStepBuilder(StepKind.LOG, StepDefinition.Log::new));
        registerBuilder(new LogYamlStepBuilder());
        registerBuilder(new ScalarStepBuilder(StepKind.THROW, StepDefinition.Throw::new));
        registerBuilder(new ReturnStepBuilder());
        registerBuilder(new SetStepBuilder());
        registerBuilder(new ScalarStepBuilder(StepKind.EXPR, StepDefinition.Expr::new));
        registerBuilder(new ScalarStepBuilder(StepKind.TASK, StepDefinition.Task::new));
        registerBuilder(new ScriptStepBuilder());
        registerBuilder(new ScalarStepBuilder(StepKind.CALL, StepDefinition.Call::new));
        registerBuilder(new ScalarStepBuilder(StepKind.CHECKPOINT, StepDefinition.Checkpoint::new));
        registerBuilder(new ScalarStepBuilder(StepKind.SUSPEND, StepDefinition.Suspend::new));
        registerBuilder(new FormCallStepBuilder());
        registerBuilder(new IfStepBuilder());
        registerBuilder(new SwitchStepBuilder());
        registerBuilder(new BlockStepBuilder(StepKind.PARALLEL, StepDefinition.Parallel::new));
        registerBuilder(new BlockStepBuilder(StepKind.BLOCK, StepDefinition.Block::new));
        registerBuilder(new BlockStepBuilder(StepKind.TRY, StepDefinition.Try::new));

        logger.fine("Registered builders for " + builders.size() + " step kinds");
    }

    void registerBuilder(StepBuilder builder) {
        StepBuilder previous = builders.put(builder.getKind(), builder);
        if (previous != null) {
            logger.fine("Replaced builder for step kind: " + builder.getKind().key());
        }
    }

    /**
     * @throws IllegalStateException if no builder is registered for the kind
     */
    StepBuilder getBuilder(StepKind kind) {
        StepBuilder builder = builders.get(kind);
        if (builder == null) {
            throw new IllegalStateException("No builder registered for step kind: " + kind.key());
        }
        return builder;
    }
}
