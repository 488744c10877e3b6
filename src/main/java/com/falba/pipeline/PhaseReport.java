package com.falba.pipeline;

import com.falba.model.RunKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Issues collected during one pipeline phase, in the order they occurred.
 */
public record PhaseReport(Phase phase, List<PipelineIssue> issues) {

    public enum Phase {
        ENRICHMENT,
        DERIVATION
    }

    public PhaseReport {
        issues = List.copyOf(issues);
    }

    public List<PipelineIssue> errors() {
        return issues.stream()
            .filter(i -> i.severity() == PipelineIssue.Severity.ERROR)
            .toList();
    }

    public List<PipelineIssue> warnings() {
        return issues.stream()
            .filter(i -> i.severity() == PipelineIssue.Severity.WARNING)
            .toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == PipelineIssue.Severity.ERROR);
    }

    static Collector collector(Phase phase) {
        return new Collector(phase);
    }

    /** Single aggregation point for the issues of a phase. */
    static final class Collector {
        private final Phase phase;
        private final List<PipelineIssue> issues = new ArrayList<>();

        private Collector(Phase phase) {
            this.phase = phase;
        }

        void warning(RunKey run, String source, String handler, String message) {
            issues.add(new PipelineIssue(PipelineIssue.Severity.WARNING, run, source, handler, message));
        }

        void error(RunKey run, String source, String handler, String message) {
            issues.add(new PipelineIssue(PipelineIssue.Severity.ERROR, run, source, handler, message));
        }

        PhaseReport build() {
            return new PhaseReport(phase, issues);
        }
    }
}
