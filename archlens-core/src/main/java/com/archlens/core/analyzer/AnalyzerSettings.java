package com.archlens.core.analyzer;

import com.archlens.core.config.ProjectConfig;

import java.util.Objects;

/**
 * Thresholds of the graph health checks.
 *
 * @param bottleneckThreshold incoming edge count at which a node is reported as a bottleneck
 * @param deadEndMinLayer lowest node layer checked for dead-ends
 */
public record AnalyzerSettings(
    int bottleneckThreshold,
    int deadEndMinLayer
) {
    /**
     * Compact constructor with validation.
     */
    public AnalyzerSettings {
        if (bottleneckThreshold < 1) {
            throw new IllegalArgumentException("bottleneckThreshold must be positive: " + bottleneckThreshold);
        }
    }

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(ProjectConfig.DEFAULT_BOTTLENECK_THRESHOLD, ProjectConfig.DEFAULT_DEAD_END_MIN_LAYER);
    }

    /**
     * Reads the thresholds of the {@code analysis} section.
     *
     * @param config project configuration
     * @return settings, defaults for omitted values
     */
    public static AnalyzerSettings from(ProjectConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new AnalyzerSettings(
            config.analysis().effectiveBottleneckThreshold(),
            config.analysis().effectiveDeadEndMinLayer()
        );
    }
}
