package com.archlens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for ArchLens projects.
 *
 * <p>Loaded from {@code archlens.yaml} in the project root. Any section may be
 * omitted; omitted values fall back to the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my-project"
 *
 * scan:
 *   includePaths: [src, lib]
 *   ignoreFolders: [generated]
 *   ignoreFiles: [secrets.json]
 *   binaryExtensions: [.woff]
 *   maxConcurrency: 8
 *
 * flow:
 *   maxLines: 500
 *
 * analysis:
 *   bottleneckThreshold: 5
 *   deadEndMinLayer: 1
 *
 * output:
 *   directory: "./archlens-out"
 * }</pre>
 *
 * @param project project metadata
 * @param scan file discovery settings
 * @param flow control-flow reconstruction settings
 * @param analysis health analyzer settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("scan") ScanConfig scan,
    @JsonProperty("flow") FlowConfig flow,
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("output") OutputConfig output
) {
    /** Default number of files extracted in parallel. */
    public static final int DEFAULT_MAX_CONCURRENCY = 8;

    /** Default per-file line cap of the flow reconstructor. */
    public static final int DEFAULT_FLOW_MAX_LINES = 500;

    /** Default number of incoming edges that marks a bottleneck. */
    public static final int DEFAULT_BOTTLENECK_THRESHOLD = 5;

    /** Default lowest layer checked for dead-ends. */
    public static final int DEFAULT_DEAD_END_MIN_LAYER = 1;

    /**
     * Compact constructor filling omitted sections with defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("project", null);
        }
        if (scan == null) {
            scan = new ScanConfig(List.of(), List.of(), List.of(), List.of(), null);
        }
        if (flow == null) {
            flow = new FlowConfig(null);
        }
        if (analysis == null) {
            analysis = new AnalysisConfig(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
    }

    /**
     * Creates the default configuration: no scan scope restriction, built-in ignore
     * rules only, default thresholds.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * File discovery settings. Lists are added to the built-in defaults.
     *
     * @param includePaths top-level paths to restrict the scan to (empty = whole project)
     * @param ignoreFolders additional folder names to skip
     * @param ignoreFiles additional file names to skip
     * @param binaryExtensions additional file suffixes to skip
     * @param maxConcurrency number of files extracted in parallel
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanConfig(
        @JsonProperty("includePaths") List<String> includePaths,
        @JsonProperty("ignoreFolders") List<String> ignoreFolders,
        @JsonProperty("ignoreFiles") List<String> ignoreFiles,
        @JsonProperty("binaryExtensions") List<String> binaryExtensions,
        @JsonProperty("maxConcurrency") Integer maxConcurrency
    ) {
        public ScanConfig {
            includePaths = includePaths == null ? List.of() : List.copyOf(includePaths);
            ignoreFolders = ignoreFolders == null ? List.of() : List.copyOf(ignoreFolders);
            ignoreFiles = ignoreFiles == null ? List.of() : List.copyOf(ignoreFiles);
            binaryExtensions = binaryExtensions == null ? List.of() : List.copyOf(binaryExtensions);
        }

        /**
         * Returns the configured concurrency, or the default when unset or not positive.
         *
         * @return effective concurrency limit
         */
        public int effectiveMaxConcurrency() {
            return maxConcurrency != null && maxConcurrency > 0 ? maxConcurrency : DEFAULT_MAX_CONCURRENCY;
        }
    }

    /**
     * Control-flow reconstruction settings.
     *
     * @param maxLines maximum number of lines examined per file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlowConfig(
        @JsonProperty("maxLines") Integer maxLines
    ) {
        public int effectiveMaxLines() {
            return maxLines != null && maxLines > 0 ? maxLines : DEFAULT_FLOW_MAX_LINES;
        }
    }

    /**
     * Health analyzer thresholds.
     *
     * @param bottleneckThreshold incoming edge count at which a node is a bottleneck
     * @param deadEndMinLayer lowest node layer checked for dead-ends
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("bottleneckThreshold") Integer bottleneckThreshold,
        @JsonProperty("deadEndMinLayer") Integer deadEndMinLayer
    ) {
        public int effectiveBottleneckThreshold() {
            return bottleneckThreshold != null && bottleneckThreshold > 0
                ? bottleneckThreshold
                : DEFAULT_BOTTLENECK_THRESHOLD;
        }

        public int effectiveDeadEndMinLayer() {
            return deadEndMinLayer != null ? deadEndMinLayer : DEFAULT_DEAD_END_MIN_LAYER;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "./archlens-out";
            }
        }
    }
}
