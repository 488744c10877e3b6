package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Fact;
import com.falba.model.Observations;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Reads the output of {@code nixos-version --json}. */
public class NixosVersionEnricher extends JsonDocumentEnricher {

    @Override
    public String name() {
        return "nixos-version";
    }

    @Override
    protected boolean handles(String fileName) {
        return "nixos-version.json".equals(fileName);
    }

    @Override
    protected Observations extract(Artifact artifact, JsonNode root) {
        requireObject(artifact, root, "top level must be an object");
        String revision = requireText(artifact, root.get("configurationRevision"),
            "missing configurationRevision");
        return Observations.ofFacts(List.of(Fact.of("nixos_configuration_revision", revision)));
    }
}
