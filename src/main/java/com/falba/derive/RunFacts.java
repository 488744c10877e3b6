package com.falba.derive;

import com.falba.model.AttributeValue;
import com.falba.model.Fact;
import com.falba.model.Run;

import java.util.Optional;

/** Typed lookups of fact values; empty when absent or of another type. */
final class RunFacts {

    private RunFacts() {
    }

    static Optional<String> string(Run run, String name) {
        return run.getFact(name)
            .map(Fact::value)
            .filter(v -> v.kind() == AttributeValue.Kind.STRING)
            .map(v -> ((AttributeValue.StringValue) v).value());
    }

    static Optional<Boolean> bool(Run run, String name) {
        return run.getFact(name)
            .map(Fact::value)
            .filter(v -> v.kind() == AttributeValue.Kind.BOOL)
            .map(v -> ((AttributeValue.BoolValue) v).value());
    }
}
