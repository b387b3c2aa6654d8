package com.mcpcheck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for mcp-check.
 * Routes to subcommands: run, list, health.
 */
@Command(
        name = "mcpcheck",
        mixinStandardHelpOptions = true,
        version = "mcp-check 0.1.0",
        description = "Dependency-aware test runner for MCP servers",
        subcommands = {
                RunCommand.class,
                ListCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class McpCheckCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
