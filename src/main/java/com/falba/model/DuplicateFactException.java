package com.falba.model;

/**
 * Thrown when a fact is added to a run that already has a fact of the same
 * name. The run keeps the first fact.
 */
public class DuplicateFactException extends RuntimeException {

    private final String factName;

    public DuplicateFactException(RunKey run, String factName) {
        super("fact already exists on " + run + ": " + factName);
        this.factName = factName;
    }

    public String getFactName() {
        return factName;
    }
}
