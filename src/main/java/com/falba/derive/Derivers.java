package com.falba.derive;

import java.util.List;

public final class Derivers {

    private Derivers() {
    }

    /** The standard derivers in the order they run. */
    public static List<Deriver> standard() {
        return List.of(
            new AsiOnDeriver(),
            new RetbleedMitigationDeriver()
        );
    }
}
