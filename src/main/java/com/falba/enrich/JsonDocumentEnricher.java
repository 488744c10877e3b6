package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Observations;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Base for enrichers reading one JSON document. Handles file-name dispatch,
 * parsing, and the shape checks every JSON enricher needs.
 */
public abstract class JsonDocumentEnricher implements Enricher {

    /** Whether this enricher handles files with the given base name. */
    protected abstract boolean handles(String fileName);

    protected abstract Observations extract(Artifact artifact, JsonNode root);

    @Override
    public final Observations extract(Artifact artifact) {
        if (!handles(artifact.fileName())) {
            return Observations.empty();
        }
        JsonNode root;
        try {
            root = artifact.json();
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read or parse JSON", ex);
        }
        return extract(artifact, root);
    }

    protected JsonNode requireObject(Artifact artifact, JsonNode node, String message) {
        if (node == null || !node.isObject()) {
            throw new ExtractionException(name(), artifact, message);
        }
        return node;
    }

    protected JsonNode requireArray(Artifact artifact, JsonNode node, String message) {
        if (node == null || !node.isArray()) {
            throw new ExtractionException(name(), artifact, message);
        }
        return node;
    }

    protected String requireText(Artifact artifact, JsonNode node, String message) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw new ExtractionException(name(), artifact, message);
        }
        return node.textValue();
    }

    protected JsonNode requireNumber(Artifact artifact, JsonNode node, String message) {
        if (node == null || !node.isNumber()) {
            throw new ExtractionException(name(), artifact, message);
        }
        return node;
    }
}
