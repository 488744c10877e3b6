package com.falba.derive;

import com.falba.model.Fact;
import com.falba.model.Observations;
import com.falba.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Derives {@code retbleed_mitigation} from the kernel command line.
 *
 * Patterns are tried in order and the first substring match wins. The
 * {@code auto,nosmt} and {@code unret} outcomes depend on whether SMT was
 * active ({@code lscpu_smp_active}, false when missing). The
 * {@code retbleed=unret,nosmt} rule comes after {@code retbleed=unret} and so
 * never fires; the order is kept as found in the benchmark tooling.
 */
public class RetbleedMitigationDeriver implements Deriver {

    private static final Logger log = LoggerFactory.getLogger(RetbleedMitigationDeriver.class);

    static final String FACT = "retbleed_mitigation";
    static final String UNKNOWN = "unknown";

    private record Rule(String pattern, Function<Boolean, String> outcome) {}

    private static final List<Rule> RULES = List.of(
        new Rule("retbleed=off", smt -> "off"),
        new Rule("retbleed=auto,nosmt", smt -> smt ? "stibp" : "unret"),
        new Rule("retbleed=ibpb", smt -> "ibpb"),
        new Rule("retbleed=unret", smt -> smt ? "stibp" : "unret"),
        new Rule("retbleed=unret,nosmt", smt -> "stibp")
    );

    @Override
    public String name() {
        return "retbleed-mitigation";
    }

    @Override
    public Observations derive(Run run) {
        Optional<String> cmdline = RunFacts.string(run, "cmdline");
        if (cmdline.isEmpty()) {
            log.debug("{}: no string cmdline fact on {}, skipping", name(), run.getKey());
            return Observations.empty();
        }
        boolean smtActive = RunFacts.bool(run, "lscpu_smp_active").orElse(false);

        String mitigation = UNKNOWN;
        for (Rule rule : RULES) {
            if (cmdline.get().contains(rule.pattern())) {
                mitigation = rule.outcome().apply(smtActive);
                break;
            }
        }
        log.debug("{}: {} smt_active={} mitigation={}", name(), run.getKey(), smtActive, mitigation);
        return Observations.ofFacts(List.of(Fact.of(FACT, mitigation)));
    }
}
