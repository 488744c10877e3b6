package com.falba.query;

import com.falba.model.RunKey;

import java.util.List;

/**
 * Outcome of filtering a corpus with one expression. Matches are in corpus
 * order; runs the expression could not be evaluated on are listed separately
 * and count as non-matching.
 */
public record MatchReport(String expression, List<RunKey> matches, List<Failure> failures) {

    public record Failure(RunKey run, String message) {
    }

    public MatchReport {
        matches = List.copyOf(matches);
        failures = List.copyOf(failures);
    }

    /** One {@code testName/runId} line per matching run. */
    public List<String> lines() {
        return matches.stream().map(RunKey::toString).toList();
    }
}
