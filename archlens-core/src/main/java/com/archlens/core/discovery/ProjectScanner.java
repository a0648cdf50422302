package com.archlens.core.discovery;

import com.archlens.core.extractor.ExtractorRegistry;
import com.archlens.core.model.FileSummary;
import com.archlens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts file summaries, in parallel for whole projects.
 *
 * <p>At most {@code maxConcurrency} files are read and extracted at the same time.
 * Results come back in input order. An unreadable file, or an extractor failing on a
 * file, yields an empty summary so that one file never aborts a run.
 */
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    private final ProjectFileTree tree;
    private final ExtractorRegistry registry;
    private final int maxConcurrency;

    public ProjectScanner(ProjectFileTree tree, ExtractorRegistry registry, int maxConcurrency) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Extracts one file.
     *
     * @param path absolute path, or path relative to the project root
     * @return summary keyed by the project-relative path, empty when the file is missing or unreadable
     */
    public FileSummary scanFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path absolute = path.isAbsolute() ? path.normalize() : tree.root().resolve(path).normalize();
        String relative = FileUtils.toRelativePath(tree.root(), absolute);

        if (!Files.isRegularFile(absolute)) {
            log.warn("Cannot scan {}, file not found", absolute);
            return FileSummary.empty(relative);
        }
        return extract(relative);
    }

    /**
     * Extracts many files with bounded parallelism.
     *
     * @param relativePaths project-relative paths
     * @return one summary per path, in input order
     */
    public List<FileSummary> scanAll(List<String> relativePaths) {
        Objects.requireNonNull(relativePaths, "relativePaths must not be null");
        if (relativePaths.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(maxConcurrency, relativePaths.size());
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "archlens-scan-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Future<FileSummary>> futures = new ArrayList<>();
            for (String relativePath : relativePaths) {
                futures.add(executor.submit(() -> extract(relativePath)));
            }

            List<FileSummary> summaries = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                summaries.add(await(futures.get(i), relativePaths.get(i)));
            }
            log.info("Extracted {} files with {} threads", summaries.size(), threads);
            return summaries;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileSummary extract(String relativePath) {
        try {
            return registry.extract(tree.read(relativePath));
        } catch (RuntimeException e) {
            log.warn("Extraction failed for {}: {}", relativePath, e.getMessage());
            return FileSummary.empty(relativePath);
        }
    }

    private FileSummary await(Future<FileSummary> future, String relativePath) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Extraction failed for {}: {}", relativePath, e.getCause().getMessage());
            return FileSummary.empty(relativePath);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning " + relativePath, e);
        }
    }
}
