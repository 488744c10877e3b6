package com.falba.enrich;

import com.falba.model.Artifact;

/**
 * Thrown by an enricher when an artifact has the shape it handles but its
 * content is unreadable or malformed. Scoped to that one artifact.
 */
public class ExtractionException extends RuntimeException {

    private final String enricher;

    public ExtractionException(String enricher, Artifact artifact, String message) {
        super(enricher + ": " + artifact.path() + ": " + message);
        this.enricher = enricher;
    }

    public ExtractionException(String enricher, Artifact artifact, String message, Throwable cause) {
        super(enricher + ": " + artifact.path() + ": " + message, cause);
        this.enricher = enricher;
    }

    public String getEnricher() {
        return enricher;
    }
}
