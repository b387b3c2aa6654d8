package com.mcpcheck.plugins;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suite definition: expectations for the built-in plugins plus declarative tool checks.
 *
 * <pre>
 * mcpcheck:
 *   suite:
 *     built-ins: true
 *     expect:
 *       tools: [get_pattern, render_template]
 *       resources: ["pattern://fastmcp-tools"]
 *       read-resource-uri: "pattern://fastmcp-tools"
 *       read-resource-markers: ["# FastMCP Tool Implementation Pattern"]
 *     checks:
 *       - name: GetPatternCheck
 *         tool: get_pattern
 *         arguments: { name: fastmcp-tools }
 *         expect-contains: ["@mcp.tool"]
 *         hard-deps: [ListToolsPlugin]
 *       - name: GetUnknownPatternCheck
 *         tool: get_pattern
 *         arguments: { name: nonexistent-pattern }
 *         expect-error: true
 *         soft-order: [GetPatternCheck]
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "mcpcheck.suite")
public class SuiteProperties {

    private boolean builtIns = true;
    private Expectations expect = new Expectations();
    private List<ToolCheck> checks = new ArrayList<>();

    public boolean isBuiltIns() { return builtIns; }
    public void setBuiltIns(boolean builtIns) { this.builtIns = builtIns; }
    public Expectations getExpect() { return expect; }
    public void setExpect(Expectations expect) { this.expect = expect; }
    public List<ToolCheck> getChecks() { return checks; }
    public void setChecks(List<ToolCheck> checks) { this.checks = checks; }

    public static class Expectations {
        private List<String> tools = new ArrayList<>();
        private List<String> resources = new ArrayList<>();
        private String readResourceUri;
        private List<String> readResourceMarkers = new ArrayList<>();

        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
        public List<String> getResources() { return resources; }
        public void setResources(List<String> resources) { this.resources = resources; }
        public String getReadResourceUri() { return readResourceUri; }
        public void setReadResourceUri(String readResourceUri) { this.readResourceUri = readResourceUri; }
        public List<String> getReadResourceMarkers() { return readResourceMarkers; }
        public void setReadResourceMarkers(List<String> readResourceMarkers) { this.readResourceMarkers = readResourceMarkers; }
    }

    /**
     * One tool call and what its response must (or must not) contain.
     */
    public static class ToolCheck {
        private String name;
        private String tool;
        private String description;
        private Map<String, Object> arguments = new LinkedHashMap<>();
        private List<String> expectContains = new ArrayList<>();
        private boolean expectError = false;
        private List<String> hardDeps = new ArrayList<>();
        private List<String> softOrder = new ArrayList<>();
        private Duration timeout;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public Map<String, Object> getArguments() { return arguments; }
        public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
        public List<String> getExpectContains() { return expectContains; }
        public void setExpectContains(List<String> expectContains) { this.expectContains = expectContains; }
        public boolean isExpectError() { return expectError; }
        public void setExpectError(boolean expectError) { this.expectError = expectError; }
        public List<String> getHardDeps() { return hardDeps; }
        public void setHardDeps(List<String> hardDeps) { this.hardDeps = hardDeps; }
        public List<String> getSoftOrder() { return softOrder; }
        public void setSoftOrder(List<String> softOrder) { this.softOrder = softOrder; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
