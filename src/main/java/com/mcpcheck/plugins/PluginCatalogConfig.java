package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.PluginCatalog;
import com.mcpcheck.core.plugin.TestPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the plugin catalog from an explicit list: the built-in protocol checks
 * followed by the tool checks declared in configuration.
 */
@Configuration
public class PluginCatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(PluginCatalogConfig.class);

    @Bean
    public PluginCatalog pluginCatalog(SuiteProperties suite) {
        var catalog = buildCatalog(suite);
        log.info("Registered {} plugin(s): {}", catalog.size(),
                catalog.plugins().stream().map(TestPlugin::name).toList());
        return catalog;
    }

    static PluginCatalog buildCatalog(SuiteProperties suite) {
        List<TestPlugin> plugins = new ArrayList<>();
        if (suite.isBuiltIns()) {
            var expect = suite.getExpect();
            plugins.add(new ServerPingPlugin());
            plugins.add(new ListToolsPlugin(expect.getTools()));
            plugins.add(new ListResourcesPlugin(expect.getResources()));
            plugins.add(new ReadResourcePlugin(expect.getReadResourceUri(), expect.getReadResourceMarkers()));
            plugins.add(new ListPromptsPlugin());
        }
        for (var check : suite.getChecks()) {
            plugins.add(new ToolCallPlugin(check));
        }
        return new PluginCatalog(plugins);
    }
}
