package com.mcpcheck.core.plugin;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, explicitly assembled set of plugins for a run.
 * Validates name uniqueness on construction.
 */
public record PluginCatalog(List<TestPlugin> plugins) {

    public PluginCatalog {
        plugins = List.copyOf(plugins);
        Set<String> seen = new HashSet<>();
        for (TestPlugin plugin : plugins) {
            String name = plugin.name();
            if (name == null || name.isBlank()) {
                throw new PluginConfigurationException(
                        "Plugin " + plugin.getClass().getName() + " has a blank name");
            }
            if (!seen.add(name)) {
                throw new PluginConfigurationException("Duplicate plugin name: " + name);
            }
        }
    }

    public static PluginCatalog of(TestPlugin... plugins) {
        return new PluginCatalog(List.of(plugins));
    }

    public Optional<TestPlugin> find(String name) {
        return plugins.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Returns a catalog restricted to the given names, keeping catalog order.
     * Unknown names are ignored.
     */
    public PluginCatalog only(Set<String> names) {
        if (names == null || names.isEmpty()) return this;
        return new PluginCatalog(plugins.stream().filter(p -> names.contains(p.name())).toList());
    }

    public int size() {
        return plugins.size();
    }

    public boolean isEmpty() {
        return plugins.isEmpty();
    }
}
