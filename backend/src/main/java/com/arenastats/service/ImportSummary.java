package com.arenastats.service;

/**
 * Counts for one import run.
 */
public record ImportSummary(
        Long importSessionId,
        int matchesFound,
        int matchesImported,
        int matchesSkipped,
        int matchesFailed,
        int parseErrors
) {
    public boolean hasImports() {
        return matchesImported > 0;
    }
}
