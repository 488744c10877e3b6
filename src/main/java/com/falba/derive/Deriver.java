package com.falba.derive;

import com.falba.model.Observations;
import com.falba.model.Run;

/**
 * Computes new facts from facts a run already has. Derivers read facts only,
 * never artifacts, and must be deterministic.
 *
 * A deriver whose inputs are missing or of an unexpected type is simply not
 * applicable and returns {@link Observations#empty()}; that is never an error.
 */
public interface Deriver {

    /** Unique identifier, e.g. "asi-on". */
    String name();

    Observations derive(Run run);
}
