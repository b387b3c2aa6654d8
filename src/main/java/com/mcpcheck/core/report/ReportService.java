package com.mcpcheck.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the {@link Reporter} for a format and writes report files.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final Map<ReportFormat, Reporter> reporters = new EnumMap<>(ReportFormat.class);

    public ReportService(List<Reporter> reporters) {
        for (Reporter reporter : reporters) {
            this.reporters.put(reporter.format(), reporter);
        }
    }

    public Reporter reporterFor(ReportFormat format) {
        Reporter reporter = reporters.get(format);
        if (reporter == null) {
            throw new IllegalArgumentException("No reporter registered for format " + format);
        }
        return reporter;
    }

    /**
     * Writes the report to {@code file}, creating parent directories as needed.
     */
    public Path write(Report report, ReportFormat format, Path file) throws IOException {
        reporterFor(format).write(report, file);
        log.info("Wrote {} report with {} test(s) to {}", format, report.summary().total(), file);
        return file;
    }
}
