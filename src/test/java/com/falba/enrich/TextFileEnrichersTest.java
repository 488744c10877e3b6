package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.AttributeValue;
import com.falba.model.Fact;
import com.falba.model.Metric;
import com.falba.model.Observations;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextFileEnrichersTest {

    @TempDir
    Path dir;

    private Artifact write(String name, String content) throws IOException {
        return Artifact.of(Files.writeString(dir.resolve(name), content));
    }

    @Test
    void osRelease_keepsIdVersionAndVariant() throws IOException {
        Observations result = new OsReleaseEnricher().extract(write("etc_os-release",
            "# comment\nNAME=\"Ubuntu\"\nID=ubuntu\nVERSION_ID=\"22.04\"\nPRETTY_NAME=\"Ubuntu 22.04.4 LTS\"\n"));

        assertEquals(List.of(
            Fact.of("os_release_id", "ubuntu"),
            Fact.of("os_release_version_id", "22.04")
        ), result.facts());
    }

    @Test
    void osRelease_malformedLine_failsTheArtifact() throws IOException {
        Artifact artifact = write("etc_os-release", "ID=ubuntu\nthis is not a pair\n");
        assertThrows(ExtractionException.class, () -> new OsReleaseEnricher().extract(artifact));
    }

    @Test
    void elapsedNanos_becomesMetricWithUnit() throws IOException {
        Observations result = new ElapsedTimeEnricher().extract(write("compile-kernel_elapsed_ns_0", "123456789\n"));

        assertEquals(List.of(new Metric("compile-kernel_elapsed", AttributeValue.of(123456789L), "ns")),
            result.metrics());
    }

    @Test
    void elapsedNanos_garbage_failsTheArtifact() throws IOException {
        Artifact artifact = write("compile-kernel_elapsed_ns_1", "soon");
        assertThrows(ExtractionException.class, () -> new ElapsedTimeEnricher().extract(artifact));
    }

    @Test
    void nixosSystem_keepsTheWholeFile() throws IOException {
        Observations result = new NixosSystemEnricher().extract(
            write("nixos-system.txt", "/nix/store/abc-nixos-system-host-24.05\n"));

        assertEquals(List.of(Fact.of("nixos_system", "/nix/store/abc-nixos-system-host-24.05\n")), result.facts());
    }

    @Test
    void sysfsVulnerabilities_oneFactPerFileWithNulsTrimmed() throws IOException {
        Path archive = Tarballs.builder()
            .entry("/sys/devices/system/cpu/vulnerabilities/retbleed", "Mitigation: untrained return thunk\n\0\0")
            .entry("sys/devices/system/cpu/vulnerabilities/meltdown", "Not affected\n")
            .entry("/sys/devices/system/cpu/online", "0-7\n")
            .writeTo(Files.createDirectories(dir.resolve("tmp")).resolve("sysfs_cpu.tgz"));

        Observations result = new SysfsCpuVulnerabilitiesEnricher().extract(Artifact.of(archive));

        assertEquals(List.of(
            Fact.of("sysfs_cpu_vuln:retbleed", "Mitigation: untrained return thunk"),
            Fact.of("sysfs_cpu_vuln:meltdown", "Not affected")
        ), result.facts());
    }

    @Test
    void sysfsArchiveOutsideTmp_isIgnored() throws IOException {
        Path archive = Tarballs.builder()
            .entry("/sys/devices/system/cpu/vulnerabilities/retbleed", "Vulnerable")
            .writeTo(dir.resolve("sysfs_cpu.tgz"));

        assertTrue(new SysfsCpuVulnerabilitiesEnricher().extract(Artifact.of(archive)).isEmpty());
    }

    @Test
    void sysfsCorruptArchive_failsTheArtifact() throws IOException {
        Path archive = Files.writeString(Files.createDirectories(dir.resolve("tmp")).resolve("sysfs_cpu.tgz"), "nope");
        assertThrows(ExtractionException.class,
            () -> new SysfsCpuVulnerabilitiesEnricher().extract(Artifact.of(archive)));
    }
}
