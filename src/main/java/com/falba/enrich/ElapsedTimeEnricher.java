package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Metric;
import com.falba.model.Observations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads {@code compile-kernel_elapsed_ns_*} files, each holding a single
 * nanosecond duration.
 */
public class ElapsedTimeEnricher implements Enricher {

    private static final String PREFIX = "compile-kernel_elapsed_ns_";

    @Override
    public String name() {
        return "elapsed-ns";
    }

    @Override
    public Observations extract(Artifact artifact) {
        if (!artifact.fileName().startsWith(PREFIX)) {
            return Observations.empty();
        }
        String text;
        try {
            text = new String(artifact.content(), StandardCharsets.UTF_8).strip();
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read file", ex);
        }
        long nanos;
        try {
            nanos = Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw new ExtractionException(name(), artifact, "does not contain an integer", ex);
        }
        return Observations.ofMetrics(List.of(
            new Metric("compile-kernel_elapsed", AttributeValue.of(nanos), "ns")));
    }
}
