package com.mcpcheck.core.engine;

import com.mcpcheck.core.report.ReportFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runner defaults. CLI options take precedence.
 *
 * <pre>
 * mcpcheck:
 *   runner:
 *     plugin-timeout: 60s
 *     report-format: json
 *     report-output: build/mcp-check.json
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "mcpcheck.runner")
public class RunnerProperties {

    private Duration pluginTimeout = Duration.ofSeconds(60);
    private ReportFormat reportFormat = ReportFormat.JSON;
    private String reportOutput;

    public Duration getPluginTimeout() { return pluginTimeout; }
    public void setPluginTimeout(Duration pluginTimeout) { this.pluginTimeout = pluginTimeout; }
    public ReportFormat getReportFormat() { return reportFormat; }
    public void setReportFormat(ReportFormat reportFormat) { this.reportFormat = reportFormat; }
    public String getReportOutput() { return reportOutput; }
    public void setReportOutput(String reportOutput) { this.reportOutput = reportOutput; }
}
