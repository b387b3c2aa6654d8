package com.mcpcheck.core.scheduler;

import com.mcpcheck.core.plugin.PluginCatalog;
import com.mcpcheck.core.plugin.TestPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes a deterministic run order for a set of plugins from their declared
 * hard dependencies and soft ordering edges.
 * <p>
 * Depth-first post-order traversal: plugins are visited in input order, each at most
 * once, and a plugin is emitted only after all of its not-yet-visited edge targets.
 * For an acyclic graph this is a topological order that leaves unrelated plugins in
 * their input order.
 * <p>
 * Edge targets that name no plugin in the input are ignored for ordering and reported
 * as unresolved. Cycles terminate thanks to the visited set; the order produced for
 * cycle members depends on input order and is not a valid topological order, so the
 * back edges are reported as well.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public Resolution resolve(PluginCatalog catalog) {
        return resolve(catalog.plugins());
    }

    public Resolution resolve(List<TestPlugin> plugins) {
        Map<String, TestPlugin> byName = new LinkedHashMap<>();
        for (var plugin : plugins) {
            byName.putIfAbsent(plugin.name(), plugin);
        }

        var traversal = new Traversal(byName);
        for (var plugin : plugins) {
            traversal.visit(plugin);
        }

        if (!traversal.unresolved.isEmpty()) {
            log.warn("Ignoring dependency references to unknown plugins: {}", traversal.unresolved);
        }
        if (!traversal.cycles.isEmpty()) {
            log.warn("Dependency cycle(s) detected, order for cycle members is input-dependent: {}",
                    traversal.cycles);
        }

        var resolution = new Resolution(traversal.result, traversal.unresolved, traversal.cycles);
        log.debug("Resolved run order: {}", resolution.orderedNames());
        return resolution;
    }

    private static final class Traversal {

        private final Map<String, TestPlugin> byName;
        private final Set<String> visited = new HashSet<>();
        /** Plugins whose subtree is still being processed; hitting one again is a back edge. */
        private final Set<String> inProgress = new HashSet<>();
        private final List<TestPlugin> result = new ArrayList<>();
        private final Set<String> unresolved = new LinkedHashSet<>();
        private final List<String> cycles = new ArrayList<>();

        Traversal(Map<String, TestPlugin> byName) {
            this.byName = byName;
        }

        void visit(TestPlugin plugin) {
            String name = plugin.name();
            if (!visited.add(name)) return;
            inProgress.add(name);

            for (String dep : edgesOf(plugin)) {
                TestPlugin target = byName.get(dep);
                if (target == null) {
                    unresolved.add(dep);
                } else if (inProgress.contains(dep)) {
                    cycles.add(name + " -> " + dep);
                } else {
                    visit(target);
                }
            }

            inProgress.remove(name);
            result.add(plugin);
        }

        private static Set<String> edgesOf(TestPlugin plugin) {
            var edges = new LinkedHashSet<String>();
            if (plugin.hardDeps() != null) edges.addAll(plugin.hardDeps());
            if (plugin.softOrder() != null) edges.addAll(plugin.softOrder());
            return edges;
        }
    }
}
