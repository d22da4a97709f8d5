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

package dev.mars.flowlang.parser.observability;

import dev.mars.flowlang.diagnostics.Diagnostic;
import dev.mars.flowlang.model.StepKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the flow document parser.
 *
 * Provides 5 parser metrics:
 * - flowlang.parser.documents.total (counter) - Documents parsed
 * - flowlang.parser.documents.invalid (counter) - Documents parsed with at least one error
 * - flowlang.parser.steps.total (counter) - Steps parsed, by step type
 * - flowlang.parser.diagnostics.total (counter) - Diagnostics reported, by kind and severity
 * - flowlang.parser.duration.seconds (histogram) - Parse duration distribution
 *
 * Without a registered OpenTelemetry SDK all instruments are no-ops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0 (OpenTelemetry)
 */
public class ParserMetrics {

    private static final Logger logger = Logger.getLogger(ParserMetrics.class.getName());
    private static final String METER_NAME = "flowlang-parser";

    // Singleton instance
    private static ParserMetrics instance;

    // Counters
    private final LongCounter documentsTotal;
    private final LongCounter documentsInvalid;
    private final LongCounter stepsTotal;
    private final LongCounter diagnosticsTotal;

    // Histograms
    private final DoubleHistogram parseDuration;

    private final AtomicLong documentsParsed = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> DIAGNOSTIC_KIND_KEY = AttributeKey.stringKey("diagnostic.kind");
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("diagnostic.severity");

    private ParserMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        documentsTotal = meter.counterBuilder("flowlang.parser.documents.total")
                .setDescription("Total number of flow documents parsed")
                .setUnit("1")
                .build();

        documentsInvalid = meter.counterBuilder("flowlang.parser.documents.invalid")
                .setDescription("Number of flow documents parsed with errors")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("flowlang.parser.steps.total")
                .setDescription("Total number of steps parsed")
                .setUnit("1")
                .build();

        diagnosticsTotal = meter.counterBuilder("flowlang.parser.diagnostics.total")
                .setDescription("Total number of diagnostics reported")
                .setUnit("1")
                .build();

        parseDuration = meter.histogramBuilder("flowlang.parser.duration.seconds")
                .setDescription("Flow document parse duration in seconds")
                .setUnit("s")
                .build();

        logger.info("ParserMetrics initialized");
    }

    /**
     * Get the singleton instance of ParserMetrics.
     */
    public static synchronized ParserMetrics getInstance() {
        if (instance == null) {
            instance = new ParserMetrics();
        }
        return instance;
    }

    /**
     * Record one parsed document with its step counts and diagnostics.
     */
    public void recordDocumentParsed(Map<StepKind, Integer> stepCounts, List<Diagnostic> diagnostics,
                                     double durationSeconds) {
        documentsTotal.add(1);
        documentsParsed.incrementAndGet();
        parseDuration.record(durationSeconds);

        stepCounts.forEach((kind, count) ->
                stepsTotal.add(count, Attributes.of(STEP_TYPE_KEY, kind.key())));

        boolean invalid = false;
        for (Diagnostic diagnostic : diagnostics) {
            Attributes attrs = Attributes.builder()
                    .put(DIAGNOSTIC_KIND_KEY, diagnostic.getKind().name())
                    .put(SEVERITY_KEY, diagnostic.getSeverity().name())
                    .build();
            diagnosticsTotal.add(1, attrs);
            invalid |= diagnostic.isError();
        }
        if (invalid) {
            documentsInvalid.add(1);
        }
    }

    /**
     * Get the number of documents recorded since startup.
     */
    public long getDocumentsParsed() {
        return documentsParsed.get();
    }
}
