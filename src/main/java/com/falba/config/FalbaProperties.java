package com.falba.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "falba")
public class FalbaProperties {

    /** Root of the result database: one directory per test, one per run below it. */
    private Path resultDb = Path.of("results");

    private final Archive archive = new Archive();

    public Path getResultDb() { return resultDb; }
    public void setResultDb(Path resultDb) { this.resultDb = resultDb; }
    public Archive getArchive() { return archive; }

    public static class Archive {
        /** How many levels of nested tarballs are expanded. 0 disables archive support. */
        private int maxDepth = 3;
        /** Parent of the per-extraction temp directories; system temp dir when unset. */
        private Path scratchDir;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public Path getScratchDir() { return scratchDir; }
        public void setScratchDir(Path scratchDir) { this.scratchDir = scratchDir; }
    }
}
