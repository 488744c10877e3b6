package com.falba.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What one enricher or deriver call produced for a run: facts, metrics and
 * warnings the caller should surface (e.g. a log that yielded no metrics).
 */
public record Observations(
    List<Fact> facts,
    List<Metric> metrics,
    List<String> warnings
) {

    private static final Observations EMPTY = new Observations(List.of(), List.of(), List.of());

    public Observations {
        facts = List.copyOf(facts);
        metrics = List.copyOf(metrics);
        warnings = List.copyOf(warnings);
    }

    /** The "not applicable" result. */
    public static Observations empty() {
        return EMPTY;
    }

    public static Observations ofFacts(List<Fact> facts) {
        return new Observations(facts, List.of(), List.of());
    }

    public static Observations ofMetrics(List<Metric> metrics) {
        return new Observations(List.of(), metrics, List.of());
    }

    public boolean isEmpty() {
        return facts.isEmpty() && metrics.isEmpty() && warnings.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Fact> facts = new ArrayList<>();
        private final List<Metric> metrics = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder() {
        }

        public Builder fact(Fact fact) {
            facts.add(fact);
            return this;
        }

        public Builder metric(Metric metric) {
            metrics.add(metric);
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder addAll(Observations other) {
            facts.addAll(other.facts());
            metrics.addAll(other.metrics());
            warnings.addAll(other.warnings());
            return this;
        }

        public int metricCount() {
            return metrics.size();
        }

        public Observations build() {
            return new Observations(facts, metrics, warnings);
        }
    }
}
