package com.falba.pipeline;

import com.falba.config.FalbaProperties;
import com.falba.derive.Derivers;
import com.falba.enrich.Enrichers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfiguration {

    /**
     * Pipeline with the standard enrichers and derivers. Archive nesting depth
     * and scratch location come from {@code falba.archive.*}.
     */
    @Bean
    public PipelineService pipelineService(FalbaProperties properties) {
        return new PipelineService(
            Enrichers.standard(properties.getArchive().getMaxDepth(), properties.getArchive().getScratchDir()),
            Derivers.standard()
        );
    }
}
