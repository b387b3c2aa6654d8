package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.PluginConfigurationException;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.core.scheduler.DependencyResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginCatalogConfigTest {

    private static SuiteProperties.ToolCheck check(String name, String tool, List<String> hardDeps) {
        var check = new SuiteProperties.ToolCheck();
        check.setName(name);
        check.setTool(tool);
        check.setHardDeps(hardDeps);
        return check;
    }

    @Test
    @DisplayName("Built-ins come first, then tool checks in declaration order")
    void builtInsThenChecks() {
        var suite = new SuiteProperties();
        suite.setChecks(List.of(check("GetPattern", "get_pattern", List.of("ListToolsPlugin"))));

        var catalog = PluginCatalogConfig.buildCatalog(suite);

        assertEquals(List.of("ServerPingPlugin", "ListToolsPlugin", "ListResourcesPlugin",
                        "ReadResourcePlugin", "ListPromptsPlugin", "GetPattern"),
                catalog.plugins().stream().map(TestPlugin::name).toList());
    }

    @Test
    void builtInsCanBeDisabled() {
        var suite = new SuiteProperties();
        suite.setBuiltIns(false);
        suite.setChecks(List.of(check("A", "tool_a", List.of())));

        assertEquals(1, PluginCatalogConfig.buildCatalog(suite).size());
        suite.setChecks(List.of());
        assertTrue(PluginCatalogConfig.buildCatalog(suite).isEmpty());
    }

    @Test
    void duplicateCheckNamesAreRejected() {
        var suite = new SuiteProperties();
        suite.setChecks(List.of(check("ListToolsPlugin", "list", List.of())));

        assertThrows(PluginConfigurationException.class, () -> PluginCatalogConfig.buildCatalog(suite));
    }

    @Test
    @DisplayName("Default catalog resolves without unresolved references or cycles")
    void defaultCatalogResolvesCleanly() {
        var resolution = new DependencyResolver().resolve(PluginCatalogConfig.buildCatalog(new SuiteProperties()));

        assertTrue(resolution.unresolved().isEmpty());
        assertFalse(resolution.hasCycles());
        assertEquals(List.of("ServerPingPlugin", "ListToolsPlugin", "ListResourcesPlugin",
                "ReadResourcePlugin", "ListPromptsPlugin"), resolution.orderedNames());
    }
}
