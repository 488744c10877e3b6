package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Fact;
import com.falba.model.Observations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TarGzEnricherTest {

    @TempDir
    Path dir;

    private Path scratch;

    @BeforeEach
    void setUp() throws IOException {
        scratch = Files.createDirectory(dir.resolve("scratch"));
    }

    private TarGzEnricher enricher(int depth) {
        return (TarGzEnricher) Enrichers.standard(depth, scratch).stream()
            .filter(e -> e instanceof TarGzEnricher)
            .findFirst()
            .orElseThrow();
    }

    private boolean scratchIsEmpty() throws IOException {
        try (Stream<Path> entries = Files.list(scratch)) {
            return entries.findAny().isEmpty();
        }
    }

    @Nested
    @DisplayName("Recursive enrichment")
    class Recursion {

        @Test
        void entriesAndNestedArchives_areEnriched() throws IOException {
            byte[] inner = Tarballs.builder()
                .entry("ansible.json", "{\"ansible_facts\": {\"ansible_cmdline\": \"quiet\"}}")
                .toBytes();
            Path outer = Tarballs.builder()
                .entry("falba-facts.json", "{\"os_id\": \"ubuntu\"}")
                .entry("sub/inner.tar.gz", inner)
                .writeTo(dir.resolve("results.tar.gz"));

            Observations result = enricher(3).extract(Artifact.of(outer));

            assertEquals(List.of(Fact.of("os_id", "ubuntu"), Fact.of("cmdline", "quiet")), result.facts());
            assertTrue(result.warnings().isEmpty());
            assertTrue(scratchIsEmpty());
        }

        @Test
        void archivesBeyondMaxDepth_areLeftAlone() throws IOException {
            byte[] inner = Tarballs.builder().entry("falba-facts.json", "{\"deep\": true}").toBytes();
            Path outer = Tarballs.builder().entry("inner.tar.gz", inner).writeTo(dir.resolve("outer.tar.gz"));

            Observations result = enricher(1).extract(Artifact.of(outer));

            assertTrue(result.facts().isEmpty());
        }

        @Test
        void nestedListNeverContainsItself() {
            TarGzEnricher top = enricher(2);
            TarGzEnricher child = (TarGzEnricher) top.getNested().stream()
                .filter(e -> e instanceof TarGzEnricher).findFirst().orElseThrow();

            assertNotSame(top, child);
            assertTrue(child.getNested().stream().noneMatch(e -> e instanceof TarGzEnricher));
            assertTrue(Enrichers.standard(0, scratch).stream().noneMatch(e -> e instanceof TarGzEnricher));
        }
    }

    @Nested
    @DisplayName("Unsafe entries")
    class UnsafeEntries {

        @Test
        void traversalAndAbsoluteNames_areSkippedWithWarning() throws IOException {
            Path archive = Tarballs.builder()
                .entry("../../etc/passwd", "root:x:0:0")
                .entry("/etc/passwd", "root:x:0:0")
                .entry("falba-facts.json", "{\"ok\": true}")
                .writeTo(dir.resolve("evil.tar.gz"));

            Observations result = enricher(1).extract(Artifact.of(archive));

            assertEquals(List.of(Fact.of("ok", true)), result.facts());
            assertEquals(2, result.warnings().size());
            assertFalse(Files.exists(dir.resolve("etc")));
            assertTrue(scratchIsEmpty());
        }

        @Test
        void resolveSafely_rejectsEscapes() {
            Path root = Path.of("/tmp/x");
            assertNull(TarGzEnricher.resolveSafely(root, "a/../../b"));
            assertNull(TarGzEnricher.resolveSafely(root, "\\windows"));
            assertNull(TarGzEnricher.resolveSafely(root, ""));
            assertEquals(root.resolve("a/b"), TarGzEnricher.resolveSafely(root, "a/b"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void corruptArchive_failsAndStillCleansScratch() throws IOException {
            Path archive = Files.writeString(dir.resolve("broken.tar.gz"), "not gzip at all");

            assertThrows(ExtractionException.class, () -> enricher(1).extract(Artifact.of(archive)));
            assertTrue(scratchIsEmpty());
        }

        @Test
        void brokenEntry_becomesWarningAndOtherEntriesSurvive() throws IOException {
            Path archive = Tarballs.builder()
                .entry("phoronix.json", "{ broken")
                .entry("falba-facts.json", "{\"ok\": 1}")
                .writeTo(dir.resolve("mixed.tar.gz"));

            Observations result = enricher(1).extract(Artifact.of(archive));

            assertEquals(List.of(Fact.of("ok", 1L)), result.facts());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).contains("phoronix"));
        }

        @Test
        void otherFileNames_areIgnored() throws IOException {
            Path file = Files.writeString(dir.resolve("results.tar"), "x");
            assertTrue(enricher(1).extract(Artifact.of(file)).isEmpty());
        }
    }
}
