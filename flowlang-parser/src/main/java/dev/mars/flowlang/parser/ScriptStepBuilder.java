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

import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.model.ScriptBody;
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.Value;

import java.util.Optional;

/**
 * Builder for {@code script} steps.
 *
 * <p>With a {@code body} sibling the script value is the language tag and the
 * body is inline text. Without one the value must reference an external
 * script, recognised by a {@code /} or a file extension, e.g.
 * {@code scripts/check.groovy}; the extension then names the language.
 * An extension must start with a letter, so version suffixes such as
 * {@code python3.11} stay language tags.
 */
final class ScriptStepBuilder implements StepBuilder {

    private static final String BODY = "body";

    @Override
    public StepKind getKind() {
        return StepKind.SCRIPT;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return BODY.equals(key);
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_FIELD);
        String script = reader.text(source.value(), "script");
        Value bodyValue = source.sibling(BODY);

        if (bodyValue != null) {
            String body = reader.text(bodyValue, BODY);
            if (script == null || body == null) {
                return Optional.empty();
            }
            return Optional.of(new StepDefinition.Script(script, new ScriptBody.Inline(body)));
        }
        if (script == null) {
            return Optional.empty();
        }
        if (isExternalReference(script)) {
            return Optional.of(new StepDefinition.Script(languageOf(script), new ScriptBody.External(script)));
        }
        reader.missing(source.step().position(), BODY,
                "Script '" + script + "' needs a 'body' or a reference to a script file");
        return Optional.empty();
    }

    static boolean isExternalReference(String script) {
        if (script.indexOf('/') >= 0) {
            return true;
        }
        int dot = script.lastIndexOf('.');
        return dot > 0 && dot < script.length() - 1 && Character.isLetter(script.charAt(dot + 1));
    }

    /**
     * @return the file extension of the reference, or the reference itself when it has none
     */
    static String languageOf(String reference) {
        String fileName = reference.substring(reference.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : reference;
    }
}
