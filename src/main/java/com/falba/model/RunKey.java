package com.falba.model;

import java.util.Comparator;

/**
 * Identity of a run inside a corpus: the test group it was discovered under
 * plus its run id.
 */
public record RunKey(String testName, String runId) implements Comparable<RunKey> {

    private static final Comparator<RunKey> ORDER =
        Comparator.comparing(RunKey::testName).thenComparing(RunKey::runId);

    public RunKey {
        if (testName == null || testName.isBlank()) {
            throw new IllegalArgumentException("testName is required");
        }
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
    }

    @Override
    public int compareTo(RunKey other) {
        return ORDER.compare(this, other);
    }

    /** Formats as {@code testName/runId}, the form printed for query matches. */
    @Override
    public String toString() {
        return testName + "/" + runId;
    }
}
