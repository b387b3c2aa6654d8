package com.mcpcheck.plugins;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans tool output for signs that the underlying operation failed even though the
 * MCP call itself succeeded (RBAC denials, unreachable backends, and so on).
 * <p>
 * Used by plugins to report application-level errors as failures; the runner has no
 * visibility into this distinction.
 */
public final class OperationalErrorDetector {

    /**
     * Error marker matched in tool output, with the surrounding text extracted for the report.
     */
    public record Detection(String marker, String context) {}

    private static final int CONTEXT_BEFORE = 50;
    private static final int CONTEXT_AFTER = 450;

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            Pattern.compile("Error (?:listing|getting|creating|updating|deleting|scaling)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Kubernetes API Error", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d{3} Forbidden", Pattern.CASE_INSENSITIVE),
            Pattern.compile("is forbidden:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("cannot (?:list|get|create|update|delete|patch) resource", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Permission denied", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Unauthorized", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Authentication failed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Connection refused", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Connection timeout", Pattern.CASE_INSENSITIVE),
            Pattern.compile("No route to host", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private OperationalErrorDetector() {} // utility class

    /**
     * Returns the first error marker found in {@code text}, checking patterns in order.
     * The context covers up to 50 characters before and 450 after the match, with
     * whitespace runs collapsed to single spaces.
     */
    public static Optional<Detection> detect(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        for (Pattern pattern : ERROR_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                int start = Math.max(0, m.start() - CONTEXT_BEFORE);
                int end = Math.min(text.length(), m.end() + CONTEXT_AFTER);
                String context = WHITESPACE.matcher(text.substring(start, end).strip()).replaceAll(" ");
                return Optional.of(new Detection(m.group(), context));
            }
        }
        return Optional.empty();
    }
}
