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

import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * Closed sum type for the variant payload of a {@link Step}.
 *
 * <p>Each permitted record corresponds to exactly one {@link StepKind}. The
 * modifiers shared by all variants live on {@link Modifiers}, never here.
 * Expression strings such as {@code ${foo.bar}} are kept as uninterpreted text.
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>Simple: {@link Log}, {@link LogYaml}, {@link Throw}, {@link Return},
 *       {@link SetVariables}, {@link Expr}, {@link Checkpoint}, {@link Suspend}</li>
 *   <li>Calls: {@link Task}, {@link Script}, {@link Call}, {@link FormCall}</li>
 *   <li>Block-structured: {@link If}, {@link Switch}, {@link Parallel},
 *       {@link Block}, {@link Try}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public sealed interface StepDefinition
        permits StepDefinition.Log, StepDefinition.LogYaml, StepDefinition.Throw,
                StepDefinition.Return, StepDefinition.SetVariables, StepDefinition.Expr,
                StepDefinition.Task, StepDefinition.Script, StepDefinition.Call,
                StepDefinition.Checkpoint, StepDefinition.Suspend, StepDefinition.FormCall,
                StepDefinition.If, StepDefinition.Switch, StepDefinition.Parallel,
                StepDefinition.Block, StepDefinition.Try {

    StepKind kind();

    /**
     * @param message the log message, possibly an expression string
     */
    record Log(String message) implements StepDefinition {
        public Log {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public StepKind kind() {
            return StepKind.LOG;
        }
    }

    /**
     * @param value the value to render, kept opaque
     */
    record LogYaml(Value value) implements StepDefinition {
        public LogYaml {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public StepKind kind() {
            return StepKind.LOG_YAML;
        }
    }

    /**
     * @param exception the error message or expression to throw
     */
    record Throw(String exception) implements StepDefinition {
        public Throw {
            Objects.requireNonNull(exception, "exception");
        }

        @Override
        public StepKind kind() {
            return StepKind.THROW;
        }
    }

    record Return() implements StepDefinition {
        @Override
        public StepKind kind() {
            return StepKind.RETURN;
        }
    }

    /**
     * @param variables variable name to value, in declaration order
     */
    record SetVariables(MappingValue variables) implements StepDefinition {
        public SetVariables {
            Objects.requireNonNull(variables, "variables");
        }

        @Override
        public StepKind kind() {
            return StepKind.SET;
        }
    }

    record Expr(String expression) implements StepDefinition {
        public Expr {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public StepKind kind() {
            return StepKind.EXPR;
        }
    }

    /**
     * @param taskName the task name or an expression yielding it
     */
    record Task(String taskName) implements StepDefinition {
        public Task {
            Objects.requireNonNull(taskName, "taskName");
        }

        @Override
        public StepKind kind() {
            return StepKind.TASK;
        }
    }

    /**
     * @param language the script language tag, or the extension of an external script
     * @param body     the inline text or the external reference
     */
    record Script(String language, ScriptBody body) implements StepDefinition {
        public Script {
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public StepKind kind() {
            return StepKind.SCRIPT;
        }
    }

    record Call(String flowName) implements StepDefinition {
        public Call {
            Objects.requireNonNull(flowName, "flowName");
        }

        @Override
        public StepKind kind() {
            return StepKind.CALL;
        }
    }

    record Checkpoint(String name) implements StepDefinition {
        public Checkpoint {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public StepKind kind() {
            return StepKind.CHECKPOINT;
        }
    }

    record Suspend(String eventName) implements StepDefinition {
        public Suspend {
            Objects.requireNonNull(eventName, "eventName");
        }

        @Override
        public StepKind kind() {
            return StepKind.SUSPEND;
        }
    }

    /**
     * A form call.
     *
     * @param formName        name of the form to show
     * @param fields          field overrides, empty when none are declared
     * @param values          initial values, or null
     * @param runAs           user/role restrictions, or null
     * @param yieldExecution  the {@code yield} option, or null when not set
     * @param saveSubmittedBy the {@code saveSubmittedBy} option, or null when not set
     */
    record FormCall(String formName,
                    List<FormField> fields,
                    MappingValue values,
                    MappingValue runAs,
                    Boolean yieldExecution,
                    Boolean saveSubmittedBy) implements StepDefinition {
        public FormCall {
            Objects.requireNonNull(formName, "formName");
            fields = fields != null ? List.copyOf(fields) : List.of();
        }

        public FormCall(String formName) {
            this(formName, List.of(), null, null, null, null);
        }

        @Override
        public StepKind kind() {
            return StepKind.FORM;
        }
    }

    /**
     * @param condition the condition expression
     * @param thenSteps steps run when the condition holds
     * @param elseSteps steps run otherwise, or null when there is no {@code else}
     */
    record If(String condition, List<Step> thenSteps, List<Step> elseSteps) implements StepDefinition {
        public If {
            Objects.requireNonNull(condition, "condition");
            thenSteps = List.copyOf(thenSteps);
            elseSteps = elseSteps != null ? List.copyOf(elseSteps) : null;
        }

        public boolean hasElse() {
            return elseSteps != null;
        }

        @Override
        public StepKind kind() {
            return StepKind.IF;
        }
    }

    /**
     * @param expression   the switch expression
     * @param cases        the cases in declaration order, {@code default} excluded
     * @param defaultSteps the default branch, or null when there is none
     */
    record Switch(String expression, List<SwitchCase> cases, List<Step> defaultSteps) implements StepDefinition {
        public Switch {
            Objects.requireNonNull(expression, "expression");
            cases = List.copyOf(cases);
            defaultSteps = defaultSteps != null ? List.copyOf(defaultSteps) : null;
        }

        public boolean hasDefault() {
            return defaultSteps != null;
        }

        @Override
        public StepKind kind() {
            return StepKind.SWITCH;
        }
    }

    record Parallel(List<Step> steps) implements StepDefinition {
        public Parallel {
            steps = List.copyOf(steps);
        }

        @Override
        public StepKind kind() {
            return StepKind.PARALLEL;
        }
    }

    record Block(List<Step> steps) implements StepDefinition {
        public Block {
            steps = List.copyOf(steps);
        }

        @Override
        public StepKind kind() {
            return StepKind.BLOCK;
        }
    }

    record Try(List<Step> steps) implements StepDefinition {
        public Try {
            steps = List.copyOf(steps);
        }

        @Override
        public StepKind kind() {
            return StepKind.TRY;
        }
    }
}
