package com.mcpcheck.core.report;

/**
 * Aggregate counts for a run.
 *
 * @param total      number of outcomes
 * @param passed     outcomes with {@code passed == true}
 * @param failed     {@code total - passed}, skipped plugins included
 * @param durationMs sum of the known plugin durations
 */
public record Summary(int total, int passed, int failed, long durationMs) {}
