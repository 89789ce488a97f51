package com.architecture.memory.graphdiff.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the diff engine, bound from {@code graph-diff.*} in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "graph-diff")
public class GraphDiffProperties {

    /**
     * Nesting limit for the deep value comparison. Deeper data is treated as cyclic.
     */
    @Min(1)
    @Max(10_000)
    private int maxDepth = 64;

    @NotBlank
    private String patchCreatedBy = "system";

    /**
     * Type transitions reported as conflicts, written as {@code from->to}.
     */
    @NotNull
    private List<@Pattern(regexp = ".+->.+") String> forbiddenTypeTransitions = new ArrayList<>(List.of(
            "component->function",
            "class->interface",
            "sync->async"));

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Defaults defaults = new Defaults();

    /**
     * Option values used when a caller does not pass {@code DiffOptions}.
     */
    @Data
    public static class Defaults {
        private boolean ignoreMetadata = false;
        private boolean ignoreTimestamps = false;
        private boolean semanticDiff = false;
        private boolean includeConflictResolution = false;
    }
}
