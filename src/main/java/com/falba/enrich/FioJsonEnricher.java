package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Metric;
import com.falba.model.Observations;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads FIO reports written with {@code --output-format=json+} to
 * {@code fio_output_*.json}. Emits the mean read latencies and the read IOPS
 * of every job.
 */
public class FioJsonEnricher extends JsonDocumentEnricher {

    private static final List<String> LATENCIES = List.of("lat_ns", "slat_ns", "clat_ns");

    @Override
    public String name() {
        return "fio-json";
    }

    @Override
    protected boolean handles(String fileName) {
        return fileName.startsWith("fio_output_") && fileName.endsWith(".json");
    }

    @Override
    protected Observations extract(Artifact artifact, JsonNode root) {
        JsonNode jobs = requireArray(artifact, root.get("jobs"), "missing jobs array");

        List<Metric> metrics = new ArrayList<>();
        for (JsonNode job : jobs) {
            String jobName = requireText(artifact, job.get("jobname"), "job without jobname");
            JsonNode read = requireObject(artifact, job.get("read"), "job " + jobName + " has no read section");
            for (String latency : LATENCIES) {
                JsonNode mean = requireNumber(artifact, read.path(latency).get("mean"),
                    "job " + jobName + " has no read." + latency + ".mean");
                metrics.add(Metric.of("fio_" + jobName + "_read_" + latency + "_mean",
                    AttributeValue.of(mean.doubleValue())));
            }
            JsonNode iops = requireNumber(artifact, read.get("iops"), "job " + jobName + " has no read.iops");
            metrics.add(Metric.of("fio_" + jobName + "_read_iops", AttributeValue.of(iops.doubleValue())));
        }
        return Observations.ofMetrics(metrics);
    }
}
