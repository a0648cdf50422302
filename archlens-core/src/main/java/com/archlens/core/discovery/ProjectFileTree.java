package com.archlens.core.discovery;

import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;
import com.archlens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Walks a project root and reads its files.
 *
 * <p>Ignored folders are pruned, ignored and binary files skipped, and only files of a
 * recognized language are listed. When include paths are configured, only those
 * entries below the root are walked.
 */
public class ProjectFileTree {

    private static final Logger log = LoggerFactory.getLogger(ProjectFileTree.class);

    private final Path root;
    private final IgnoreRules rules;
    private final List<String> includePaths;

    public ProjectFileTree(Path root, IgnoreRules rules) {
        this(root, rules, List.of());
    }

    public ProjectFileTree(Path root, IgnoreRules rules, List<String> includePaths) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.includePaths = includePaths == null ? List.of() : List.copyOf(includePaths);
    }

    public Path root() {
        return root;
    }

    /**
     * Lists the project's directories and files.
     *
     * <p>A missing root or an unreadable subtree is logged and skipped.
     *
     * @return sorted listing
     */
    public TreeListing walk() {
        TreeSet<String> directories = new TreeSet<>();
        TreeSet<String> files = new TreeSet<>();

        if (!Files.isDirectory(root)) {
            log.warn("Project root is not a directory: {}", root);
            return new TreeListing(List.of(), List.of());
        }

        for (Path start : startPaths()) {
            try {
                Files.walkFileTree(start, new Collector(directories, files));
            } catch (IOException e) {
                log.warn("Failed to walk {}: {}", start, e.getMessage());
            }
        }

        log.info("Discovered {} files in {} directories under {}", files.size(), directories.size(), root);
        return new TreeListing(new ArrayList<>(directories), new ArrayList<>(files));
    }

    /**
     * Reads a project file.
     *
     * @param relativePath project-relative path
     * @return source file, with empty content when the file cannot be read
     */
    public SourceFile read(String relativePath) {
        String normalized = FileUtils.normalize(relativePath);
        Path path = root.resolve(normalized);
        try {
            return SourceFile.of(normalized, FileUtils.readString(path));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return SourceFile.of(normalized, "");
        }
    }

    private List<Path> startPaths() {
        if (includePaths.isEmpty()) {
            return List.of(root);
        }
        List<Path> starts = new ArrayList<>();
        for (String includePath : includePaths) {
            Path start = root.resolve(FileUtils.normalize(includePath)).normalize();
            if (!start.startsWith(root)) {
                log.warn("Include path escapes the project root, ignoring: {}", includePath);
            } else if (Files.exists(start)) {
                starts.add(start);
            } else {
                log.debug("Include path does not exist: {}", includePath);
            }
        }
        return starts;
    }

    private final class Collector extends SimpleFileVisitor<Path> {

        private final TreeSet<String> directories;
        private final TreeSet<String> files;

        Collector(TreeSet<String> directories, TreeSet<String> files) {
            this.directories = directories;
            this.files = files;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            if (rules.isIgnoredFolder(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            directories.add(FileUtils.toRelativePath(root, dir));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            String relative = FileUtils.toRelativePath(root, file);
            if (attrs.isRegularFile()
                && !rules.isIgnoredFile(relative)
                && Language.fromPath(relative) != Language.UNKNOWN) {
                files.add(relative);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            log.warn("Cannot access {}: {}", file, e.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
