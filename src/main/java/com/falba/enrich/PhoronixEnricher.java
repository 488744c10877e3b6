package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Fact;
import com.falba.model.Metric;
import com.falba.model.Observations;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Reads a Phoronix Test Suite result export, {@code phoronix.json}.
 *
 * <ul>
 *   <li>{@code system.hardware} becomes the fact {@code phoronix_system_hardware}</li>
 *   <li>each entry of {@code results} becomes one metric named by its {@code title},
 *       valued by its {@code value}, with {@code scale} as unit when non-empty</li>
 * </ul>
 * Result entries without a title or value are skipped with a warning.
 */
public class PhoronixEnricher extends JsonDocumentEnricher {

    @Override
    public String name() {
        return "phoronix";
    }

    @Override
    protected boolean handles(String fileName) {
        return "phoronix.json".equals(fileName);
    }

    @Override
    protected Observations extract(Artifact artifact, JsonNode root) {
        requireObject(artifact, root, "top level must be an object");
        Observations.Builder out = Observations.builder();

        JsonNode hardware = root.path("system").path("hardware");
        if (hardware.isTextual()) {
            out.fact(Fact.of("phoronix_system_hardware", hardware.textValue()));
        }

        JsonNode results = root.get("results");
        if (results == null) {
            return out.build();
        }
        requireObject(artifact, results, "results must be an object");

        Iterator<Map.Entry<String, JsonNode>> entries = results.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode result = entry.getValue();
            JsonNode title = result.get("title");
            JsonNode value = result.get("value");
            if (title == null || !title.isTextual() || value == null || value.isNull()) {
                out.warning("phoronix result " + entry.getKey() + " in " + artifact.path()
                    + " has no title or value, skipped");
                continue;
            }
            JsonNode scale = result.get("scale");
            String unit = scale != null && scale.isTextual() && !scale.textValue().isEmpty()
                ? scale.textValue()
                : null;
            out.metric(new Metric(title.textValue(), AttributeValue.fromJson(value), unit));
        }
        return out.build();
    }
}
