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
 * Reads the output of Ansible's setup module, saved as {@code ansible.json}.
 * Each key under {@code ansible_facts} becomes a fact with the
 * {@code ansible_} prefix removed ({@code ansible_cmdline} becomes {@code cmdline}).
 */
public class AnsibleEnricher extends JsonDocumentEnricher {

    private static final String PREFIX = "ansible_";

    @Override
    public String name() {
        return "ansible";
    }

    @Override
    protected boolean handles(String fileName) {
        return "ansible.json".equals(fileName);
    }

    @Override
    protected Observations extract(Artifact artifact, JsonNode root) {
        requireObject(artifact, root, "top level must be an object");
        JsonNode ansibleFacts = root.get("ansible_facts");
        if (ansibleFacts == null) {
            return Observations.empty();
        }
        requireObject(artifact, ansibleFacts, "ansible_facts must be an object");

        List<Fact> facts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = ansibleFacts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().startsWith(PREFIX)
                ? field.getKey().substring(PREFIX.length())
                : field.getKey();
            if (name.isEmpty()) {
                continue;
            }
            facts.add(Fact.of(name, AttributeValue.fromJson(field.getValue())));
        }
        return Observations.ofFacts(facts);
    }
}
