package com.brush.matching.bulk;

import com.brush.matching.api.BrushMatcher;
import com.brush.matching.core.model.BrushInput;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.logging.LogContext;
import com.brush.matching.metrics.MetricsService;
import com.brush.matching.metrics.NoOpMetricsService;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Matches a JSON Lines stream record by record.
 *
 * <p>Input: one object per line with a {@code normalized} field and an optional
 * {@code original} field. Blank lines are skipped.</p>
 * <pre>
 * {"original": "Simpson Chubby 2 ", "normalized": "Simpson Chubby 2"}
 * {"normalized": "Elite handle w/ Declaration B15 knot"}
 * </pre>
 *
 * <p>Output: one serialized {@link MatchResult} per well-formed input line, in
 * input order. Malformed lines are reported in the summary and skipped. Records
 * are processed sequentially.</p>
 */
public class JsonLinesBatchMatcher {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesBatchMatcher.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final BrushMatcher matcher;
    private final ObjectMapper objectMapper;
    private final ObjectWriter resultWriter;
    private final MetricsService metricsService;

    public JsonLinesBatchMatcher(BrushMatcher matcher) {
        this(matcher, new ObjectMapper(), new NoOpMetricsService());
    }

    public JsonLinesBatchMatcher(BrushMatcher matcher, ObjectMapper objectMapper, MetricsService metricsService) {
        this.matcher = matcher;
        this.objectMapper = objectMapper;
        this.resultWriter = objectMapper.writerFor(MatchResult.class);
        this.metricsService = metricsService;
    }

    /**
     * Reads every line of {@code input}, writes one result line per record to
     * {@code output} and returns the counts. Neither stream is closed.
     */
    public BatchSummary matchAll(Reader input, Writer output, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<BatchSummary.BatchError> errors = new ArrayList<>();
        Map<MatchType, Long> byMatchType = new EnumMap<>(MatchType.class);
        long total = 0;
        long matched = 0;
        long unmatched = 0;

        String batchId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            BufferedReader reader = input instanceof BufferedReader b ? b : new BufferedReader(input);
            try {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    total++;

                    BrushInput record;
                    try {
                        record = parse(line);
                    } catch (JacksonException | IllegalArgumentException e) {
                        String message = e instanceof JacksonException je ? je.getOriginalMessage() : e.getMessage();
                        errors.add(new BatchSummary.BatchError(lineNumber, line, message));
                        log.warn("batch.record.malformed line={} error={}", lineNumber, message);
                        continue;
                    }

                    MatchResult result = matcher.match(record);
                    output.write(resultWriter.writeValueAsString(result));
                    output.write('\n');
                    if (result.hasMatch()) {
                        matched++;
                        byMatchType.merge(result.matchType(), 1L, Long::sum);
                    } else {
                        unmatched++;
                    }

                    if (total % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(total, -1, "Matched " + total + " records");
                    }
                }
                output.flush();
            } catch (IOException e) {
                log.error("batch.failed error={}", e.getMessage());
                errors.add(new BatchSummary.BatchError(0, "", "IO error: " + e.getMessage()));
            }

            BatchSummary summary = new BatchSummary(total, matched, unmatched, byMatchType, errors);
            metricsService.recordBatchSize(total);
            cb.onProgress(total, total, "Batch completed");
            log.info("batch.completed summary={}", summary);
            return summary;
        }
    }

    private BrushInput parse(String line) throws JacksonException {
        JsonNode node = objectMapper.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonNode normalized = node.get("normalized");
        JsonNode original = node.get("original");
        String normalizedText = normalized != null && normalized.isTextual() ? normalized.asText() : null;
        String originalText = original != null && original.isTextual() ? original.asText() : null;
        if (normalizedText == null) {
            normalizedText = originalText;
        }
        if (normalizedText == null) {
            throw new IllegalArgumentException("record has neither 'normalized' nor 'original' text");
        }
        return new BrushInput(originalText, normalizedText);
    }
}
