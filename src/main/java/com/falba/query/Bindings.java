package com.falba.query;

import com.falba.model.AttributeValue;
import com.falba.model.Run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the name-to-value map an expression is evaluated against: every
 * fact of the run plus {@value #RESULT_ID} and {@value #TEST_NAME}, which take
 * precedence over facts of the same name. {@value #RUN_ID} is bound as an
 * alias of {@value #RESULT_ID}.
 */
public final class Bindings {

    public static final String RESULT_ID = "result_id";
    public static final String RUN_ID = "run_id";
    public static final String TEST_NAME = "test_name";

    private Bindings() {
    }

    public static Map<String, AttributeValue> of(Run run) {
        Map<String, AttributeValue> binding = new LinkedHashMap<>(run.factValues());
        binding.put(RESULT_ID, AttributeValue.of(run.getRunId()));
        binding.put(RUN_ID, AttributeValue.of(run.getRunId()));
        binding.put(TEST_NAME, AttributeValue.of(run.getTestName()));
        return Collections.unmodifiableMap(binding);
    }
}
