package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.PluginConfigurationException;
import com.mcpcheck.mcp.McpSession;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls one tool with fixed arguments and classifies the response.
 * <p>
 * A response counts as an error when the server sets {@code isError}, when the text
 * starts with "Error:", or when {@link OperationalErrorDetector} finds an error marker.
 * With {@code expectError} the check passes only on an error response; otherwise it
 * fails on one and additionally requires every expected marker in the text.
 */
public class ToolCallPlugin extends AbstractMcpPlugin {

    private final String name;
    private final Map<String, Object> arguments;
    private final List<String> expectContains;
    private final boolean expectError;
    private final Duration timeout;

    public ToolCallPlugin(SuiteProperties.ToolCheck check) {
        super(requireTool(check),
                check.getDescription() != null ? check.getDescription() : "Calls tool " + check.getTool(),
                check.getHardDeps(), check.getSoftOrder());
        this.name = check.getName() != null && !check.getName().isBlank()
                ? check.getName()
                : check.getTool();
        this.arguments = check.getArguments() != null
                ? new LinkedHashMap<>(check.getArguments())
                : new LinkedHashMap<>();
        this.expectContains = check.getExpectContains() != null ? List.copyOf(check.getExpectContains()) : List.of();
        this.expectError = check.isExpectError();
        this.timeout = check.getTimeout();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new PluginConfigurationException("Tool check '" + name + "' has a non-positive timeout: " + timeout);
        }
    }

    private static String requireTool(SuiteProperties.ToolCheck check) {
        if (check.getTool() == null || check.getTool().isBlank()) {
            throw new PluginConfigurationException("Tool check '" + check.getName() + "' does not name a tool");
        }
        return check.getTool();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        var result = session.callTool(targetOperation(), arguments);
        String text = ContentText.of(result);

        String errorDetail = null;
        if (Boolean.TRUE.equals(result.isError()) || text.startsWith("Error:")) {
            errorDetail = text.isEmpty() ? "Tool reported an error" : text;
        } else {
            var detection = OperationalErrorDetector.detect(text);
            if (detection.isPresent()) {
                errorDetail = detection.get().context();
            }
        }

        if (expectError) {
            if (errorDetail == null) {
                return fail("Expected an error response but the call succeeded", abbreviate(text), startMs);
            }
            return pass("Tool returned the expected error", startMs);
        }

        if (errorDetail != null) {
            return fail("Tool returned an error", errorDetail, startMs);
        }

        var missing = expectContains.stream().filter(m -> !text.contains(m)).toList();
        if (!missing.isEmpty()) {
            return fail("Response missing expected content: " + missing, "Got: " + abbreviate(text), startMs);
        }
        return pass("Tool call succeeded (" + text.length() + " chars)", startMs);
    }

    @Override
    protected String failureMessage() {
        return "Tool call failed";
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
