package com.mcpcheck.core.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.PluginState;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Structured JSON report.
 * <pre>
 * {
 *   "timestamp": "2026-01-01T00:00:00Z",
 *   "transport": "http",
 *   "url": "http://localhost:8000/mcp",
 *   "cancelled": false,
 *   "summary": { "total": 2, "passed": 1, "failed": 1, "durationMs": 42 },
 *   "tests": [ { "pluginName": ..., "targetOperation": ..., "state": ..., "passed": ...,
 *                "message": ..., "error": ..., "durationMs": ... } ]
 * }
 * </pre>
 * {@link #read(Reader)} parses the same layout back into a {@link Report}.
 */
@Component
public class JsonReporter implements Reporter {

    private static final String TRANSPORT = "http";

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public void write(Report report, Writer out) throws IOException {
        objectMapper.writeValue(out, toDocument(report));
    }

    public String writeToString(Report report) throws IOException {
        return objectMapper.writeValueAsString(toDocument(report));
    }

    public Report read(Reader in) throws IOException {
        return fromDocument(objectMapper.readValue(in, JsonReport.class));
    }

    public Report read(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    private JsonReport toDocument(Report report) {
        var tests = report.outcomes().stream()
                .map(o -> new JsonTest(o.pluginName(), o.targetOperation(), o.state(), o.passed(),
                        o.message(), o.error(), o.durationMs()))
                .toList();
        return new JsonReport(report.timestamp(), TRANSPORT, report.target(),
                report.cancelled(), report.summary(), tests);
    }

    private static Report fromDocument(JsonReport document) {
        List<JsonTest> tests = document.tests() != null ? document.tests() : List.of();
        var outcomes = tests.stream()
                .map(t -> new Outcome(t.pluginName(), t.targetOperation(), t.passed(), t.message(),
                        t.error(), t.durationMs(), t.state()))
                .toList();
        Summary summary = document.summary() != null
                ? document.summary()
                : ResultAggregator.summarize(outcomes);
        return new Report(document.timestamp(), document.url(), outcomes, summary, document.cancelled());
    }

    record JsonReport(
        Instant timestamp,
        String transport,
        String url,
        boolean cancelled,
        Summary summary,
        List<JsonTest> tests
    ) {}

    record JsonTest(
        String pluginName,
        String targetOperation,
        PluginState state,
        boolean passed,
        String message,
        String error,
        Long durationMs
    ) {}
}
