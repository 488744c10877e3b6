package com.falba.enrich;

import com.falba.model.Artifact;
import com.falba.model.Fact;
import com.falba.model.Observations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a copy of {@code /etc/os-release} saved as {@code etc_os-release}.
 * Only {@code ID}, {@code VERSION_ID} and {@code VARIANT_ID} are kept.
 */
public class OsReleaseEnricher implements Enricher {

    private static final Map<String, String> FACT_NAMES = Map.of(
        "ID", "os_release_id",
        "VERSION_ID", "os_release_version_id",
        "VARIANT_ID", "os_release_variant_id"
    );

    @Override
    public String name() {
        return "os-release";
    }

    @Override
    public Observations extract(Artifact artifact) {
        if (!"etc_os-release".equals(artifact.fileName())) {
            return Observations.empty();
        }
        String content;
        try {
            content = new String(artifact.content(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ExtractionException(name(), artifact, "failed to read file", ex);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : content.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new ExtractionException(name(), artifact, "not an os-release line: " + line);
            }
            fields.put(trimmed.substring(0, eq), unquote(artifact, trimmed.substring(eq + 1)));
        }

        Observations.Builder out = Observations.builder();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String factName = FACT_NAMES.get(field.getKey());
            if (factName != null) {
                out.fact(Fact.of(factName, field.getValue()));
            }
        }
        return out.build();
    }

    private String unquote(Artifact artifact, String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        if (raw.indexOf(' ') >= 0 || raw.indexOf('"') >= 0 || raw.indexOf('\'') >= 0) {
            throw new ExtractionException(name(), artifact, "invalid os-release value: " + raw);
        }
        return raw;
    }
}
