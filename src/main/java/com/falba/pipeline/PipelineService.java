package com.falba.pipeline;

import com.falba.derive.Deriver;
import com.falba.enrich.Enricher;
import com.falba.enrich.ExtractionException;
import com.falba.model.Artifact;
import com.falba.model.Corpus;
import com.falba.model.DuplicateFactException;
import com.falba.model.Fact;
import com.falba.model.Metric;
import com.falba.model.Observations;
import com.falba.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drives enrichment and derivation over a corpus.
 *
 * Both phases tolerate partial failure:
 * <ul>
 *   <li>a duplicate fact is dropped and recorded as a warning</li>
 *   <li>an enricher error abandons that artifact and is recorded as an error</li>
 *   <li>a deriver error is recorded and the next deriver still runs</li>
 * </ul>
 * Derivers run in list order and each one's facts are merged before the next
 * runs, so later derivers can build on earlier ones.
 */
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final List<Enricher> enrichers;
    private final List<Deriver> derivers;

    public PipelineService(List<Enricher> enrichers, List<Deriver> derivers) {
        this.enrichers = List.copyOf(enrichers);
        this.derivers = List.copyOf(derivers);
    }

    public List<Enricher> getEnrichers() {
        return enrichers;
    }

    public List<Deriver> getDerivers() {
        return derivers;
    }

    public PhaseReport applyEnrichers(Corpus corpus) {
        PhaseReport.Collector report = PhaseReport.collector(PhaseReport.Phase.ENRICHMENT);
        for (Run run : corpus.getRuns()) {
            for (Artifact artifact : run.getArtifacts()) {
                enrichArtifact(run, artifact, report);
            }
        }
        PhaseReport result = report.build();
        log.info("Enrichment done: {} runs, {} errors, {} warnings",
            corpus.size(), result.errors().size(), result.warnings().size());
        return result;
    }

    public PhaseReport applyDerivers(Corpus corpus) {
        PhaseReport.Collector report = PhaseReport.collector(PhaseReport.Phase.DERIVATION);
        for (Run run : corpus.getRuns()) {
            for (Deriver deriver : derivers) {
                Observations observations;
                try {
                    observations = deriver.derive(run);
                } catch (RuntimeException ex) {
                    log.error("Deriver {} failed on {}", deriver.name(), run.getKey(), ex);
                    report.error(run.getKey(), run.getKey().toString(), deriver.name(), String.valueOf(ex.getMessage()));
                    continue;
                }
                merge(run, run.getKey().toString(), deriver.name(), observations, report);
            }
        }
        PhaseReport result = report.build();
        log.info("Derivation done: {} runs, {} errors, {} warnings",
            corpus.size(), result.errors().size(), result.warnings().size());
        return result;
    }

    private void enrichArtifact(Run run, Artifact artifact, PhaseReport.Collector report) {
        String source = artifact.path().toString();
        for (Enricher enricher : enrichers) {
            Observations observations;
            try {
                observations = enricher.extract(artifact);
            } catch (ExtractionException ex) {
                log.warn("Failed to enrich {} with {}: {}", source, enricher.name(), ex.getMessage());
                report.error(run.getKey(), source, enricher.name(), ex.getMessage());
                return;
            } catch (RuntimeException ex) {
                log.error("Unexpected failure enriching {} with {}", source, enricher.name(), ex);
                report.error(run.getKey(), source, enricher.name(), "unexpected error: " + ex);
                return;
            }
            merge(run, source, enricher.name(), observations, report);
        }
    }

    private void merge(Run run, String source, String handler,
                       Observations observations, PhaseReport.Collector report) {
        for (Fact fact : observations.facts()) {
            try {
                run.addFact(fact);
            } catch (DuplicateFactException ex) {
                log.warn("Discarding duplicate fact {} from {} on {}", fact.name(), handler, run.getKey());
                report.warning(run.getKey(), source, handler, ex.getMessage());
            }
        }
        for (Metric metric : observations.metrics()) {
            run.addMetric(metric);
        }
        for (String warning : observations.warnings()) {
            report.warning(run.getKey(), source, handler, warning);
        }
    }
}
