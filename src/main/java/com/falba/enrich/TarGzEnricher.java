package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Observations;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Expands a {@code *.tar.gz} artifact and enriches every file inside it.
 *
 * The archive is unpacked into a temporary directory owned by this call and
 * removed before returning, whether extraction succeeded or not. Each regular
 * entry is handed to the nested enricher list given at construction; their
 * results are concatenated into the archive's own result.
 *
 * The nested list never contains this instance. Nested archives are only
 * expanded if the list contains a {@code TarGzEnricher} of its own, which is
 * how {@link Enrichers#standard} bounds recursion depth.
 *
 * Entries with an absolute name or a {@code ..} segment are skipped with a
 * warning. A nested enricher failing on one entry turns into a warning too,
 * so one bad file does not hide the rest of the archive.
 */
public class TarGzEnricher implements Enricher {

    private static final Logger log = LoggerFactory.getLogger(TarGzEnricher.class);

    private static final String SUFFIX = ".tar.gz";
    private static final String TEMP_PREFIX = "falba-tar-";

    private final List<Enricher> nested;
    private final Path scratchParent;

    /**
     * @param nested enrichers applied to the extracted entries
     * @param scratchParent directory for temporary extraction, {@code null} for the system default
     */
    public TarGzEnricher(List<Enricher> nested, Path scratchParent) {
        this.nested = List.copyOf(nested);
        this.scratchParent = scratchParent;
    }

    public List<Enricher> getNested() {
        return nested;
    }

    @Override
    public String name() {
        return "tar-gz";
    }

    @Override
    public Observations extract(Artifact artifact) {
        if (!artifact.fileName().endsWith(SUFFIX)) {
            return Observations.empty();
        }

        Path scratch = createScratch(artifact);
        try {
            Observations result = expandAndEnrich(artifact, scratch);
            if (result.facts().isEmpty() && result.metrics().isEmpty()) {
                log.info("No facts or metrics extracted from the contents of {}", artifact.path());
            }
            return result;
        } finally {
            deleteScratch(scratch);
        }
    }

    private Observations expandAndEnrich(Artifact artifact, Path scratch) {
        Observations.Builder out = Observations.builder();
        try (InputStream raw = artifact.openStream();
             TarArchiveInputStream tar = new TarArchiveInputStream(new GZIPInputStream(raw))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (!entry.isFile()) {
                    continue;
                }
                String entryName = entry.getName();
                Path target = resolveSafely(scratch, entryName);
                if (target == null) {
                    String warning = "skipping unsafe path in " + artifact.path() + ": " + entryName;
                    log.warn(warning);
                    out.warning(warning);
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                out.addAll(enrichEntry(artifact, entryName, target));
            }
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read archive", ex);
        }
        return out.build();
    }

    private Observations enrichEntry(Artifact archive, String entryName, Path extracted) {
        Artifact entryArtifact;
        try {
            entryArtifact = Artifact.of(extracted);
        } catch (IllegalArgumentException ex) {
            String warning = "extracted entry " + entryName + " of " + archive.path() + " vanished: " + ex.getMessage();
            log.warn(warning);
            return Observations.builder().warning(warning).build();
        }

        Observations.Builder out = Observations.builder();
        for (Enricher enricher : nested) {
            try {
                out.addAll(enricher.extract(entryArtifact));
            } catch (ExtractionException ex) {
                String warning = "enricher " + enricher.name() + " failed on " + entryName
                    + " in " + archive.path() + ": " + ex.getMessage();
                log.warn(warning);
                out.warning(warning);
            }
        }
        return out.build();
    }

    /**
     * @return the extraction target inside {@code scratch}, or {@code null} if the
     *         entry name would escape it
     */
    static Path resolveSafely(Path scratch, String entryName) {
        if (entryName.isEmpty() || entryName.startsWith("/") || entryName.startsWith("\\")) {
            return null;
        }
        for (String segment : entryName.split("[/\\\\]")) {
            if ("..".equals(segment)) {
                return null;
            }
        }
        Path target = scratch.resolve(entryName).normalize();
        if (!target.startsWith(scratch) || target.equals(scratch)) {
            return null;
        }
        return target;
    }

    private Path createScratch(Artifact artifact) {
        try {
            return scratchParent == null
                ? Files.createTempDirectory(TEMP_PREFIX)
                : Files.createTempDirectory(Files.createDirectories(scratchParent), TEMP_PREFIX);
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to create scratch directory", ex);
        }
    }

    private void deleteScratch(Path scratch) {
        try {
            FileSystemUtils.deleteRecursively(scratch);
        } catch (IOException ex) {
            log.error("Failed to remove scratch directory {}", scratch, ex);
        }
    }
}
