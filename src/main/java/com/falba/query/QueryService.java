package com.falba.query;

import com.falba.model.Corpus;
import com.falba.model.Run;
import com.falba.model.RunKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters the runs of a corpus with a CEL expression evaluated over each
 * run's facts.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    public MatchReport query(Corpus corpus, String expression) {
        PredicateEngine engine = new PredicateEngine(expression);
        List<RunKey> matches = new ArrayList<>();
        List<MatchReport.Failure> failures = new ArrayList<>();

        for (Run run : corpus.getRuns()) {
            try {
                if (engine.evaluate(Bindings.of(run))) {
                    matches.add(run.getKey());
                }
            } catch (EvaluationException ex) {
                log.warn("Expression not evaluable on {}: {}", run.getKey(), ex.getMessage());
                failures.add(new MatchReport.Failure(run.getKey(), ex.getMessage()));
            }
        }

        log.info("CEL expression matched {} results", matches.size());
        if (!failures.isEmpty()) {
            log.info("Expression could not be evaluated on {} of {} runs", failures.size(), corpus.size());
        }
        return new MatchReport(expression, matches, failures);
    }
}
