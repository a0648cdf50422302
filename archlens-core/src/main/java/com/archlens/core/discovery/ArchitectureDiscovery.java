package com.archlens.core.discovery;

import com.archlens.core.analyzer.AnalyzerSettings;
import com.archlens.core.analyzer.GraphHealthAnalyzer;
import com.archlens.core.assembler.FileNameLayerClassifier;
import com.archlens.core.assembler.GraphAssembler;
import com.archlens.core.assembler.LayerClassifier;
import com.archlens.core.config.ConfigLoader;
import com.archlens.core.config.ProjectConfig;
import com.archlens.core.extractor.ExtractorRegistry;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.FileSummary;
import com.archlens.core.model.ProjectStructure;
import com.archlens.core.model.Reference;
import com.archlens.core.model.StructureFile;
import com.archlens.core.resolver.ReferenceResolver;
import com.archlens.core.resolver.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs one full discovery cycle over a project: walk, extract, resolve, assemble, analyze.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiscoveryResult result = ArchitectureDiscovery.forProject(root).discover(root);
 * result.graph().nodes().forEach(node -> System.out.println(node.file()));
 * }</pre>
 */
public class ArchitectureDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureDiscovery.class);

    private final ProjectConfig config;
    private final ExtractorRegistry registry;
    private final ReferenceResolver resolver;
    private final GraphAssembler assembler;
    private final GraphHealthAnalyzer analyzer;

    public ArchitectureDiscovery(ProjectConfig config) {
        this(config, ExtractorRegistry.loadDefault(), new FileNameLayerClassifier());
    }

    public ArchitectureDiscovery(ProjectConfig config, ExtractorRegistry registry, LayerClassifier layerClassifier) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = new ReferenceResolver();
        this.assembler = new GraphAssembler(layerClassifier);
        this.analyzer = new GraphHealthAnalyzer(AnalyzerSettings.from(config));
    }

    /**
     * Creates a discovery configured from the project's {@code archlens.yaml}, or defaults.
     *
     * @param projectRoot project root directory
     * @return discovery facade
     */
    public static ArchitectureDiscovery forProject(Path projectRoot) {
        return new ArchitectureDiscovery(ConfigLoader.loadFromProject(projectRoot));
    }

    /**
     * Discovers the architecture of a project.
     *
     * @param root project root directory
     * @return graph, summaries and health issues
     */
    public DiscoveryResult discover(Path root) {
        Objects.requireNonNull(root, "root must not be null");
        log.info("Discovering architecture of {}", root);

        ProjectFileTree tree = new ProjectFileTree(root, IgnoreRules.from(config.scan()), config.scan().includePaths());
        TreeListing listing = tree.walk();

        ProjectScanner scanner = new ProjectScanner(tree, registry, config.scan().effectiveMaxConcurrency());
        List<FileSummary> summaries = scanner.scanAll(listing.files());

        List<Reference> references = summaries.stream()
            .flatMap(summary -> summary.references().stream())
            .toList();
        ResolutionResult resolution = resolver.resolveDependencies(listing.files(), references);

        List<StructureFile> files = listing.files().stream()
            .map(FileClassifier::toStructureFile)
            .toList();
        ProjectStructure structure = new ProjectStructure(
            listing.directories(), files, resolution.dependencies(), resolution.externalTokens());

        ArchitectureGraph graph = assembler.assemble(structure);
        List<AnalysisIssue> issues = analyzer.analyze(graph);

        log.info("Discovery complete: {} files, {} dependencies, {} issues",
            files.size(), resolution.dependencies().size(), issues.size());
        return new DiscoveryResult(graph, summaries, issues);
    }
}
