package com.falba.enrich;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ordered enricher lists handed to the pipeline.
 */
public final class Enrichers {

    private Enrichers() {
    }

    /**
     * The enrichers that read single files, in the order they are applied.
     */
    public static List<Enricher> fileEnrichers() {
        return List.of(
            new AnsibleEnricher(),
            new PhoronixEnricher(),
            new SysfsCpuVulnerabilitiesEnricher(),
            new TraceLogEnricher(),
            new FalbaFactsEnricher(),
            new OsReleaseEnricher(),
            new FioJsonEnricher(),
            new NixosVersionEnricher(),
            new ElapsedTimeEnricher(),
            new NixosSystemEnricher()
        );
    }

    /**
     * File enrichers plus a tarball enricher whose nested list is built the same
     * way with one level less, until {@code archiveDepth} reaches 0. Archives
     * nested deeper than that are left alone.
     *
     * @param scratchDir parent for temporary extraction directories, {@code null} for the system default
     */
    public static List<Enricher> standard(int archiveDepth, Path scratchDir) {
        List<Enricher> enrichers = new ArrayList<>(fileEnrichers());
        if (archiveDepth > 0) {
            enrichers.add(new TarGzEnricher(standard(archiveDepth - 1, scratchDir), scratchDir));
        }
        return List.copyOf(enrichers);
    }
}
