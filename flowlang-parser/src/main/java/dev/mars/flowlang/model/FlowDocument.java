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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The AST of one flow document.
 *
 * @param configuration the configuration block, or null when absent
 * @param flows         flows by name, in declaration order
 * @param forms         forms by name, in declaration order
 * @param publicFlows   the declared public flow names, or null when absent
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record FlowDocument(Configuration configuration,
                           Map<String, Flow> flows,
                           Map<String, Form> forms,
                           List<String> publicFlows) {

    public FlowDocument {
        flows = Collections.unmodifiableMap(new LinkedHashMap<>(flows != null ? flows : Map.of()));
        forms = Collections.unmodifiableMap(new LinkedHashMap<>(forms != null ? forms : Map.of()));
        publicFlows = publicFlows != null ? List.copyOf(publicFlows) : null;
    }

    public static FlowDocument empty() {
        return new FlowDocument(null, Map.of(), Map.of(), null);
    }

    public Optional<Configuration> getConfiguration() {
        return Optional.ofNullable(configuration);
    }

    public Optional<Flow> flow(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    public Optional<Form> form(String name) {
        return Optional.ofNullable(forms.get(name));
    }

    public boolean isPublic(String flowName) {
        return publicFlows != null && publicFlows.contains(flowName);
    }
}
