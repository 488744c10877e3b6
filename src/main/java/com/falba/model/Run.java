package com.falba.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One benchmark execution: its artifacts plus the facts and metrics extracted
 * from them. Everything is append-only; nothing added to a run is ever
 * replaced or removed.
 */
public class Run {

    private final RunKey key;
    private final Map<Path, Artifact> artifacts = new LinkedHashMap<>();
    private final Map<String, Fact> facts = new LinkedHashMap<>();
    private final List<Metric> metrics = new ArrayList<>();

    public Run(RunKey key) {
        this.key = key;
    }

    public Run(String testName, String runId) {
        this(new RunKey(testName, runId));
    }

    public RunKey getKey() {
        return key;
    }

    public String getTestName() {
        return key.testName();
    }

    public String getRunId() {
        return key.runId();
    }

    public void addArtifact(Artifact artifact) {
        artifacts.putIfAbsent(artifact.path(), artifact);
    }

    /**
     * @throws DuplicateFactException if a fact with the same name is already present
     */
    public void addFact(Fact fact) {
        if (facts.containsKey(fact.name())) {
            throw new DuplicateFactException(key, fact.name());
        }
        facts.put(fact.name(), fact);
    }

    public void addMetric(Metric metric) {
        metrics.add(metric);
    }

    public Collection<Artifact> getArtifacts() {
        return Collections.unmodifiableCollection(artifacts.values());
    }

    public Map<String, Fact> getFacts() {
        return Collections.unmodifiableMap(facts);
    }

    public Optional<Fact> getFact(String name) {
        return Optional.ofNullable(facts.get(name));
    }

    public List<Metric> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    /** Snapshot of fact name to value, units dropped. */
    public Map<String, AttributeValue> factValues() {
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        facts.forEach((name, fact) -> values.put(name, fact.value()));
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Run(" + key + ", artifacts=" + artifacts.size()
            + ", facts=" + facts.size() + ", metrics=" + metrics.size() + ")";
    }
}
