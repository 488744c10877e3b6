package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Fact;
import com.falba.model.Observations;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Reads {@code tmp/sysfs_cpu.tgz}, a tarball of {@code /sys/devices/system/cpu}.
 * Every file directly under {@code vulnerabilities/} becomes a fact
 * {@code sysfs_cpu_vuln:<file name>} holding the kernel's mitigation status line.
 *
 * Entries are read straight from the stream, nothing is written to disk. Member
 * names match with or without the leading slash. tar pads sysfs files with NUL
 * bytes, which are trimmed along with surrounding whitespace.
 */
public class SysfsCpuVulnerabilitiesEnricher implements Enricher {

    private static final Path ARCHIVE = Path.of("tmp", "sysfs_cpu.tgz");
    private static final String VULNERABILITIES_DIR = "sys/devices/system/cpu/vulnerabilities/";

    static final String FACT_PREFIX = "sysfs_cpu_vuln:";

    @Override
    public String name() {
        return "sysfs-cpu";
    }

    @Override
    public Observations extract(Artifact artifact) {
        if (!artifact.path().endsWith(ARCHIVE)) {
            return Observations.empty();
        }

        List<Fact> facts = new ArrayList<>();
        try (InputStream raw = artifact.openStream();
             TarArchiveInputStream tar = new TarArchiveInputStream(new GZIPInputStream(raw))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                String file = vulnerabilityFile(entry.getName());
                if (file == null) {
                    continue;
                }
                if (!entry.isFile()) {
                    throw new ExtractionException(name(), artifact, "not a regular file: " + entry.getName());
                }
                String status = trim(new String(tar.readAllBytes(), StandardCharsets.UTF_8));
                facts.add(Fact.of(FACT_PREFIX + file, status));
            }
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read archive", ex);
        }
        return Observations.ofFacts(facts);
    }

    /** @return the file name below the vulnerabilities directory, or null for any other member */
    static String vulnerabilityFile(String entryName) {
        String name = entryName.startsWith("/") ? entryName.substring(1) : entryName;
        if (!name.startsWith(VULNERABILITIES_DIR)) {
            return null;
        }
        String file = name.substring(VULNERABILITIES_DIR.length());
        return file.isEmpty() || file.contains("/") ? null : file;
    }

    static String trim(String content) {
        int start = 0;
        int end = content.length();
        while (start < end && content.charAt(start) == '\0') {
            start++;
        }
        while (end > start && content.charAt(end - 1) == '\0') {
            end--;
        }
        return content.substring(start, end).strip();
    }
}
