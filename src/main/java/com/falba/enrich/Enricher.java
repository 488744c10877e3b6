package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Observations;

/**
 * Extracts facts and metrics from one artifact shape.
 *
 * Implementations recognize their shape by file name only and must return
 * {@link Observations#empty()} for anything else. They are stateless and may
 * be applied to any number of artifacts.
 */
public interface Enricher {

    /** Short identifier used in logs and error reports, e.g. "phoronix-json". */
    String name();

    /**
     * @return the observations, or {@link Observations#empty()} if the artifact is not handled
     * @throws ExtractionException if the artifact is handled but its content is malformed
     */
    Observations extract(Artifact artifact);
}
