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
import dev.mars.flowlang.model.Configuration;
import dev.mars.flowlang.model.Flow;
import dev.mars.flowlang.model.FlowDocument;
import dev.mars.flowlang.model.Form;
import dev.mars.flowlang.model.FormField;
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.parser.observability.ParserMetrics;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns the value tree of a flow document into a {@link FlowDocument}.
 *
 * <p>Parsing never stops at the first problem. Every problem is reported as a
 * diagnostic and the offending part is left out, so the returned document holds
 * everything that could be parsed. The top-level sections are:
 * <ul>
 *   <li>{@code configuration}: a mapping, kept as is</li>
 *   <li>{@code flows}: flow name to step sequence</li>
 *   <li>{@code forms}: form name to field sequence</li>
 *   <li>{@code publicFlows}: names of the flows callable from outside</li>
 * </ul>
 * Other top-level keys produce warnings only.
 *
 * <p>Instances hold no per-document state and may be shared between threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public class FlowDocumentParser {
    private static final Logger logger = Logger.getLogger(FlowDocumentParser.class.getName());

    private static final String CONFIGURATION = "configuration";
    private static final String FLOWS = "flows";
    private static final String FORMS = "forms";
    private static final String PUBLIC_FLOWS = "publicFlows";

    private final ParserOptions options;
    private final StepListParser stepListParser;
    private final FormFieldParser formFieldParser;

    public FlowDocumentParser() {
        this(ParserOptions.defaults());
    }

    public FlowDocumentParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.stepListParser = new StepListParser(new StepModifierExtractor(),
                new StepVariantDispatcher(new StepBuilderRegistry()));
        this.formFieldParser = new FormFieldParser();
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Parses a document root.
     *
     * @param root the root of the value tree
     * @return the document and the diagnostics, never null
     */
    public ParseResult parse(Value root) {
        Objects.requireNonNull(root, "root");
        long start = System.nanoTime();
        ParseContext context = new ParseContext(options, stepListParser, formFieldParser);

        FlowDocument document;
        if (root instanceof MappingValue mapping) {
            document = parseDocument(mapping, context);
        } else {
            context.report(DiagnosticKind.MALFORMED_DOCUMENT, root.position(),
                    "Document root must be a mapping, got " + root.describe());
            document = FlowDocument.empty();
        }

        ParseResult result = new ParseResult(document, context.diagnostics().getAll());
        logger.fine("Parsed flow document: " + document.flows().size() + " flows, "
                + document.forms().size() + " forms, " + context.diagnostics());

        if (options.metricsEnabled()) {
            ParserMetrics.getInstance().recordDocumentParsed(context.stepCounts(), result.diagnostics(),
                    (System.nanoTime() - start) / 1_000_000_000.0);
        }
        return result;
    }

    private FlowDocument parseDocument(MappingValue root, ParseContext context) {
        Configuration configuration = null;
        Map<String, Flow> flows = new LinkedHashMap<>();
        Map<String, Form> forms = new LinkedHashMap<>();
        List<String> publicFlows = null;
        Value publicFlowsValue = null;

        for (MappingValue.Entry entry : root.entries()) {
            switch (entry.key()) {
                case CONFIGURATION:
                    configuration = parseConfiguration(entry.value(), context);
                    break;
                case FLOWS:
                    context.within(FLOWS, () -> parseFlows(entry.value(), flows, context));
                    break;
                case FORMS:
                    context.within(FORMS, () -> parseForms(entry.value(), forms, context));
                    break;
                case PUBLIC_FLOWS:
                    publicFlowsValue = entry.value();
                    publicFlows = context.within(PUBLIC_FLOWS, () -> parsePublicFlows(entry.value(), context));
                    break;
                default:
                    context.report(DiagnosticKind.UNKNOWN_TOP_LEVEL_KEY, entry.position(), entry.key(),
                            "Unknown top-level key '" + entry.key() + "' is ignored");
                    break;
            }
        }

        if (publicFlows != null) {
            checkPublicFlows((SequenceValue) publicFlowsValue, flows, context);
        }
        if (options.checkFormReferences()) {
            checkFormReferences(forms, context);
        }

        return new FlowDocument(configuration, flows, forms, publicFlows);
    }

    private Configuration parseConfiguration(Value value, ParseContext context) {
        if (value instanceof MappingValue mapping) {
            return new Configuration(mapping);
        }
        context.report(DiagnosticKind.MALFORMED_SECTION, value.position(), CONFIGURATION,
                "'configuration' must be a mapping, got " + value.describe());
        return null;
    }

    private Void parseFlows(Value value, Map<String, Flow> flows, ParseContext context) {
        if (!(value instanceof MappingValue mapping)) {
            context.report(DiagnosticKind.MALFORMED_SECTION, value.position(), FLOWS,
                    "'flows' must be a mapping of flow names to steps, got " + value.describe());
            return null;
        }
        for (MappingValue.Entry entry : mapping.entries()) {
            String name = entry.key();
            if (!(entry.value() instanceof SequenceValue sequence)) {
                context.report(DiagnosticKind.MALFORMED_SECTION, entry.position(), name,
                        "Flow '" + name + "' must be a sequence of steps, got " + entry.value().describe());
                continue;
            }
            int rejectedBefore = context.rejectedSteps();
            List<Step> steps = context.within(name, () -> stepListParser.parse(sequence, context));
            flows.put(name, new Flow(steps, context.rejectedSteps() - rejectedBefore, sequence.position()));
        }
        return null;
    }

    private Void parseForms(Value value, Map<String, Form> forms, ParseContext context) {
        if (!(value instanceof MappingValue mapping)) {
            context.report(DiagnosticKind.MALFORMED_SECTION, value.position(), FORMS,
                    "'forms' must be a mapping of form names to fields, got " + value.describe());
            return null;
        }
        for (MappingValue.Entry entry : mapping.entries()) {
            String name = entry.key();
            if (!(entry.value() instanceof SequenceValue sequence)) {
                context.report(DiagnosticKind.MALFORMED_SECTION, entry.position(), name,
                        "Form '" + name + "' must be a sequence of fields, got " + entry.value().describe());
                continue;
            }
            List<FormField> fields = context.within(name, () -> formFieldParser.parse(sequence, context));
            forms.put(name, new Form(name, fields, entry.position()));
        }
        return null;
    }

    private List<String> parsePublicFlows(Value value, ParseContext context) {
        if (!(value instanceof SequenceValue sequence)) {
            context.report(DiagnosticKind.MALFORMED_SECTION, value.position(), PUBLIC_FLOWS,
                    "'publicFlows' must be a sequence of flow names, got " + value.describe());
            return null;
        }
        List<String> names = new ArrayList<>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            Value item = sequence.get(i);
            if (item instanceof ScalarValue scalar && !scalar.isNull()) {
                names.add(scalar.asString());
            } else {
                context.report(DiagnosticKind.MALFORMED_SECTION, item.position(), "[" + i + "]",
                        "Public flow name must be a scalar, got " + item.describe());
            }
        }
        return names;
    }

    // Runs after all sections are read, since publicFlows may precede flows in the source.
    private void checkPublicFlows(SequenceValue source, Map<String, Flow> flows, ParseContext context) {
        context.within(PUBLIC_FLOWS, () -> {
            for (int i = 0; i < source.size(); i++) {
                Value item = source.get(i);
                if (item instanceof ScalarValue scalar && !scalar.isNull()
                        && !flows.containsKey(scalar.asString())) {
                    context.report(DiagnosticKind.DANGLING_REFERENCE, item.position(), "[" + i + "]",
                            "Public flow '" + scalar.asString() + "' is not defined in 'flows'");
                }
            }
            return null;
        });
    }

    private void checkFormReferences(Map<String, Form> forms, ParseContext context) {
        for (ParseContext.FormReference reference : context.formReferences()) {
            if (!forms.containsKey(reference.formName())) {
                context.diagnostics().report(DiagnosticKind.DANGLING_REFERENCE, reference.position(),
                        reference.documentPath(), "form",
                        "Form '" + reference.formName() + "' is not defined in 'forms'");
            }
        }
    }
}
