package com.falba.derive;

import com.falba.model.Fact;
import com.falba.model.Observations;
import com.falba.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Derives {@code asi_on}: whether the kernel was booted with
 * {@code mitigations=auto,nosmt}, in either token order.
 */
public class AsiOnDeriver implements Deriver {

    private static final Logger log = LoggerFactory.getLogger(AsiOnDeriver.class);

    static final String FACT = "asi_on";

    @Override
    public String name() {
        return "asi-on";
    }

    @Override
    public Observations derive(Run run) {
        Optional<String> cmdline = RunFacts.string(run, "cmdline");
        if (cmdline.isEmpty()) {
            log.debug("{}: no string cmdline fact on {}, skipping", name(), run.getKey());
            return Observations.empty();
        }

        String value = cmdline.get();
        boolean asiOn = value.contains("mitigations=auto,nosmt") || value.contains("nosmt,mitigations=auto");
        log.debug("{}: {} cmdline='{}' asi_on={}", name(), run.getKey(), value, asiOn);
        return Observations.ofFacts(List.of(Fact.of(FACT, asiOn)));
    }
}
