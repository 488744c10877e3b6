package com.falba.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.TreeMap;

/**
 * All runs under analysis, keyed by test group and run id and iterated in
 * that order.
 */
public class Corpus {

    private static final Logger log = LoggerFactory.getLogger(Corpus.class);

    private final TreeMap<RunKey, Run> runs = new TreeMap<>();

    /**
     * Adds a run. A run with the same test group and id replaces the former one.
     */
    public Run add(Run run) {
        Run previous = runs.put(run.getKey(), run);
        if (previous != null) {
            log.warn("Run {} discovered twice, keeping the later one", run.getKey());
        }
        return run;
    }

    public Optional<Run> get(RunKey key) {
        return Optional.ofNullable(runs.get(key));
    }

    public Collection<Run> getRuns() {
        return Collections.unmodifiableCollection(runs.values());
    }

    public int size() {
        return runs.size();
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }
}
