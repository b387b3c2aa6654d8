package com.mcpcheck.dispatch.cli;

import com.mcpcheck.core.plugin.PluginCatalog;
import com.mcpcheck.core.scheduler.DependencyResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: mcpcheck list
 * <p>
 * Shows registered plugins in the order they would run, with their declared edges.
 * Does not contact the server.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List registered plugins in run order")
@Component
public class ListCommand implements Runnable {

    private final PluginCatalog catalog;
    private final DependencyResolver resolver;

    public ListCommand(PluginCatalog catalog, DependencyResolver resolver) {
        this.catalog = catalog;
        this.resolver = resolver;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (catalog.isEmpty()) {
            ConsoleOutput.info("No test plugins registered");
            return;
        }

        var resolution = resolver.resolve(catalog);
        ConsoleOutput.info(catalog.size() + " plugin(s) in run order:");
        int index = 1;
        for (var plugin : resolution.order()) {
            System.out.printf("%3d. %-28s %s%n", index++, plugin.name(), plugin.targetOperation());
            System.out.println("       " + plugin.description());
            if (plugin.hardDeps() != null && !plugin.hardDeps().isEmpty()) {
                System.out.println("       depends on: " + String.join(", ", plugin.hardDeps()));
            }
            if (plugin.softOrder() != null && !plugin.softOrder().isEmpty()) {
                System.out.println("       runs after: " + String.join(", ", plugin.softOrder()));
            }
        }

        if (!resolution.unresolved().isEmpty()) {
            ConsoleOutput.warn("Unknown dependency reference(s), treated as satisfied: " + resolution.unresolved());
        }
        if (resolution.hasCycles()) {
            ConsoleOutput.warn("Dependency cycle(s), order is input-dependent: " + resolution.cycles());
        }
    }
}
