package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Fact;
import com.falba.model.Observations;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code falba-facts.json}, the generic facts file benchmark scripts
 * drop next to their output.
 *
 * Every top-level key becomes a fact. A value of the form
 * {@code {"value": ..., "unit": "..."}} contributes its nested value and unit;
 * any other value is taken verbatim with no unit.
 */
public class FalbaFactsEnricher extends JsonDocumentEnricher {

    static final String FILE_NAME = "falba-facts.json";

    @Override
    public String name() {
        return "falba-facts";
    }

    @Override
    protected boolean handles(String fileName) {
        return FILE_NAME.equals(fileName);
    }

    @Override
    protected Observations extract(Artifact artifact, JsonNode root) {
        requireObject(artifact, root, "top level must be an object");

        List<Fact> facts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode raw = field.getValue();
            if (raw.isObject() && raw.has("value")) {
                JsonNode unit = raw.get("unit");
                facts.add(new Fact(field.getKey(),
                    AttributeValue.fromJson(raw.get("value")),
                    unit != null && unit.isTextual() ? unit.textValue() : null));
            } else {
                facts.add(Fact.of(field.getKey(), AttributeValue.fromJson(raw)));
            }
        }
        return Observations.ofFacts(facts);
    }
}
