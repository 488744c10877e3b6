package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Metric;
import com.falba.model.Observations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Parses bpftrace-style map dumps from {@code *.log} and {@code *.log.gz} files.
 *
 * <ul>
 *   <li>{@code @name: 42} emits metric {@code name} with value 42</li>
 *   <li>{@code @name[3]: 42} sets bucket 3 of the histogram of {@code name}</li>
 * </ul>
 *
 * Histogram lines of one name are collected into a single bucket map, emitted
 * as metric {@code name_hist} as soon as a histogram line of another name
 * shows up, and at end of stream. A log without any metric is not an error
 * but is reported as a warning.
 */
public class TraceLogEnricher implements Enricher {

    private static final Logger log = LoggerFactory.getLogger(TraceLogEnricher.class);

    private static final Pattern SCALAR = Pattern.compile("@([a-zA-Z0-9_]+):\\s*(-?\\d+)");
    private static final Pattern HISTOGRAM = Pattern.compile("@([a-zA-Z0-9_]+)\\[(\\d+)\\]:\\s*(-?\\d+)");

    static final String HISTOGRAM_SUFFIX = "_hist";

    @Override
    public String name() {
        return "trace-log";
    }

    @Override
    public Observations extract(Artifact artifact) {
        String fileName = artifact.fileName();
        boolean compressed = fileName.endsWith(".log.gz");
        if (!compressed && !fileName.endsWith(".log")) {
            return Observations.empty();
        }

        try (InputStream raw = artifact.openStream();
             InputStream in = compressed ? new GZIPInputStream(raw) : raw;
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, artifact);
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read log", ex);
        }
    }

    Observations parse(Reader source, Artifact artifact) throws IOException {
        Observations.Builder out = Observations.builder();
        HistogramAccumulator histogram = new HistogramAccumulator(out);

        BufferedReader reader = new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            Matcher scalar = SCALAR.matcher(line);
            if (scalar.find()) {
                out.metric(Metric.of(scalar.group(1), AttributeValue.of(parseValue(artifact, scalar.group(2)))));
                continue;
            }
            Matcher bucket = HISTOGRAM.matcher(line);
            if (bucket.find()) {
                histogram.add(bucket.group(1), bucket.group(2), parseValue(artifact, bucket.group(3)));
            }
        }
        histogram.flush();

        if (out.metricCount() == 0) {
            String warning = "no metrics found in trace log " + artifact.path();
            log.warn(warning);
            out.warning(warning);
        }
        return out.build();
    }

    private long parseValue(Artifact artifact, String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new ExtractionException(name(), artifact, "value out of range: " + digits, ex);
        }
    }

    /** Open histogram of the most recent name; at most one at a time. */
    private static final class HistogramAccumulator {
        private final Observations.Builder out;
        private String current;
        private Map<String, AttributeValue> buckets = new LinkedHashMap<>();

        HistogramAccumulator(Observations.Builder out) {
            this.out = out;
        }

        void add(String name, String bucket, long value) {
            if (current != null && !current.equals(name)) {
                flush();
            }
            current = name;
            buckets.put(bucket, AttributeValue.of(value));
        }

        void flush() {
            if (current != null && !buckets.isEmpty()) {
                out.metric(Metric.of(current + HISTOGRAM_SUFFIX, new AttributeValue.MapValue(buckets)));
            }
            current = null;
            buckets = new LinkedHashMap<>();
        }
    }
}
