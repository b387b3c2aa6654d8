package com.mcpcheck.core.scheduler;

import com.mcpcheck.core.plugin.TestPlugin;

import java.util.List;
import java.util.Set;

/**
 * Result of dependency resolution.
 *
 * @param order      plugins in run order
 * @param unresolved edge targets that matched no plugin (treated as satisfied)
 * @param cycles     back edges found during traversal, formatted as "from -> to"
 */
public record Resolution(
    List<TestPlugin> order,
    Set<String> unresolved,
    List<String> cycles
) {
    public Resolution {
        order = List.copyOf(order);
        unresolved = Set.copyOf(unresolved);
        cycles = List.copyOf(cycles);
    }

    public List<String> orderedNames() {
        return order.stream().map(TestPlugin::name).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
