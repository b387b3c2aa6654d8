package com.mcpcheck.dispatch.cli;

import com.mcpcheck.core.engine.CancellationSignal;
import com.mcpcheck.core.engine.RunnerProperties;
import com.mcpcheck.core.engine.TestRunEngine;
import com.mcpcheck.core.plugin.PluginCatalog;
import com.mcpcheck.core.report.Report;
import com.mcpcheck.core.report.ReportFormat;
import com.mcpcheck.core.report.ReportService;
import com.mcpcheck.mcp.McpClientManager;
import com.mcpcheck.mcp.McpConnectionException;
import com.mcpcheck.mcp.McpSession;
import com.mcpcheck.mcp.SyncClientSession;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: mcpcheck run [-u URL] [-o FILE] [-f json|junit]
 * <p>
 * Connects to the MCP server, runs every registered plugin in dependency order,
 * prints progress and a summary, optionally writes a report file, and exits with
 * the report's exit status (0 when nothing failed).
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the test suite against an MCP server")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--url", "-u"},
            description = "Server URL (default: $MCP_HTTP_URL or http://localhost:8000); /mcp is appended if missing")
    private String url;

    @Option(names = {"--output", "-o"}, description = "Save test results to this file")
    private String output;

    @Option(names = {"--format", "-f"}, description = "Report format: json, junit")
    private String format;

    @Option(names = {"--timeout", "-t"}, description = "Per-plugin timeout, e.g. 30s or PT30S")
    private String timeout;

    @Option(names = "--token", description = "Bearer token sent with every request (default: $MCP_TOKEN)")
    private String token;

    @Option(names = "--only", description = "Run only the named plugin(s); repeatable")
    private List<String> only;

    private final TestRunEngine engine;
    private final PluginCatalog catalog;
    private final McpClientManager clientManager;
    private final ReportService reportService;
    private final RunnerProperties runnerProperties;

    public RunCommand(TestRunEngine engine, PluginCatalog catalog, McpClientManager clientManager,
                      ReportService reportService, RunnerProperties runnerProperties) {
        this.engine = engine;
        this.catalog = catalog;
        this.clientManager = clientManager;
        this.reportService = reportService;
        this.runnerProperties = runnerProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ReportFormat reportFormat;
        Duration pluginTimeout;
        try {
            reportFormat = format != null ? ReportFormat.parse(format) : runnerProperties.getReportFormat();
            pluginTimeout = timeout != null ? DurationStyle.detectAndParse(timeout) : null;
            if (pluginTimeout != null && (pluginTimeout.isNegative() || pluginTimeout.isZero())) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        PluginCatalog selected = only != null ? catalog.only(new LinkedHashSet<>(only)) : catalog;
        if (selected.isEmpty()) {
            ConsoleOutput.error("No test plugins registered" + (only != null ? " matching " + only : ""));
            return 1;
        }

        ConsoleOutput.info("Registered " + selected.size() + " test plugin(s)");
        for (var plugin : selected.plugins()) {
            System.out.println("  - " + plugin.targetOperation() + ": " + plugin.description());
        }
        System.out.println();

        String targetUrl = url != null ? url : clientManager.defaultUrl();
        String bearer = token != null ? token : clientManager.defaultToken();
        ConsoleOutput.info("Connecting to: " + targetUrl);

        Report report;
        try (SyncClientSession session = clientManager.open(targetUrl, bearer)) {
            printServerInfo(session);
            report = engine.run(session, selected, session.url(), pluginTimeout,
                    new ConsoleRunListener(), new CancellationSignal());
        } catch (McpConnectionException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.summary(report);

        String outputFile = output != null ? output : runnerProperties.getReportOutput();
        if (outputFile != null && !outputFile.isBlank()) {
            try {
                Path written = reportService.write(report, reportFormat, Path.of(outputFile));
                ConsoleOutput.success("Test results saved to: " + written);
            } catch (IOException e) {
                ConsoleOutput.error("Failed to write report to " + outputFile + ": " + e.getMessage());
                return 1;
            }
        }

        return report.exitStatus();
    }

    private static void printServerInfo(McpSession session) {
        var info = session.serverInfo();
        ConsoleOutput.success("Connected to server");
        if (info != null) {
            System.out.println("   Name: " + info.name());
            System.out.println("   Version: " + info.version());
        }
        System.out.println();
    }
}
