package com.architecture.memory.graphdiff.config;

import com.architecture.memory.graphdiff.service.diff.DiffOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class GraphDiffConfig {

    /**
     * Options used by comparisons that do not pass their own, built from {@code graph-diff.defaults.*}.
     */
    @Bean
    public DiffOptions defaultDiffOptions(GraphDiffProperties properties) {
        GraphDiffProperties.Defaults defaults = properties.getDefaults();
        log.info("[GraphDiff Config] Default options: ignoreMetadata={}, ignoreTimestamps={}, semanticDiff={}, "
                        + "includeConflictResolution={}, maxDepth={}",
                defaults.isIgnoreMetadata(), defaults.isIgnoreTimestamps(), defaults.isSemanticDiff(),
                defaults.isIncludeConflictResolution(), properties.getMaxDepth());

        return DiffOptions.builder()
                .ignoreMetadata(defaults.isIgnoreMetadata())
                .ignoreTimestamps(defaults.isIgnoreTimestamps())
                .semanticDiff(defaults.isSemanticDiff())
                .includeConflictResolution(defaults.isIncludeConflictResolution())
                .build();
    }
}
