package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Fact;
import com.falba.model.Observations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Keeps the whole of {@code nixos-system.txt} as fact {@code nixos_system}. */
public class NixosSystemEnricher implements Enricher {

    static final String FILE_NAME = "nixos-system.txt";
    static final String FACT = "nixos_system";

    @Override
    public String name() {
        return "nixos-system";
    }

    @Override
    public Observations extract(Artifact artifact) {
        if (!FILE_NAME.equals(artifact.fileName())) {
            return Observations.empty();
        }
        String text;
        try {
            text = new String(artifact.content(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read file", ex);
        }
        return Observations.ofFacts(List.of(Fact.of(FACT, text)));
    }
}
