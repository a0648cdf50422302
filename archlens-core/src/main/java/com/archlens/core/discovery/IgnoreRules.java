package com.archlens.core.discovery;

import com.archlens.core.config.ProjectConfig;
import com.archlens.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Folder, file and binary-extension denylists applied while walking a project.
 *
 * <p>All comparisons are case-insensitive. Folder rules match a directory's name,
 * file rules a file's name, and extension rules the end of the path, so multi-part
 * suffixes such as {@code .tar.gz} work.
 */
public final class IgnoreRules {

    static final List<String> DEFAULT_FOLDERS = List.of(
        "node_modules", ".git", "build", "dist", "data", "out",
        ".venv", "venv", "env", "__pycache__", ".pytest_cache",
        ".idea", ".vscode", ".github", "target", "vendor",
        "bin", "obj", "ui"
    );

    static final List<String> DEFAULT_FILES = List.of(
        "package-lock.json", "pnpm-lock.yaml", "license"
    );

    static final List<String> DEFAULT_BINARY_EXTENSIONS = List.of(
        ".vsix", ".zip", ".tar.gz", ".exe", ".dll", ".so", ".bin", ".js.map",
        ".png", ".jpg", ".jpeg", ".gif", ".svg", ".pdf"
    );

    private final Set<String> folders;
    private final Set<String> files;
    private final Set<String> binaryExtensions;

    private IgnoreRules(Collection<String> folders, Collection<String> files, Collection<String> binaryExtensions) {
        this.folders = lowercase(folders);
        this.files = lowercase(files);
        this.binaryExtensions = lowercase(binaryExtensions);
    }

    public static IgnoreRules defaults() {
        return new IgnoreRules(DEFAULT_FOLDERS, DEFAULT_FILES, DEFAULT_BINARY_EXTENSIONS);
    }

    /**
     * Creates the built-in rules extended with a project's own lists.
     *
     * @param scan scan section of the project configuration
     * @return combined rules
     */
    public static IgnoreRules from(ProjectConfig.ScanConfig scan) {
        Objects.requireNonNull(scan, "scan must not be null");
        return new IgnoreRules(
            concat(DEFAULT_FOLDERS, scan.ignoreFolders()),
            concat(DEFAULT_FILES, scan.ignoreFiles()),
            concat(DEFAULT_BINARY_EXTENSIONS, scan.binaryExtensions())
        );
    }

    public boolean isIgnoredFolder(String folderName) {
        return folders.contains(folderName.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks a file against the file-name and extension denylists.
     *
     * @param filePath file name or project-relative path
     * @return true when the file must be skipped
     */
    public boolean isIgnoredFile(String filePath) {
        String lowerPath = FileUtils.normalize(filePath).toLowerCase(Locale.ROOT);
        if (files.contains(FileUtils.fileName(lowerPath))) {
            return true;
        }
        return binaryExtensions.stream().anyMatch(lowerPath::endsWith);
    }

    private static Set<String> lowercase(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(result);
    }

    private static List<String> concat(List<String> defaults, List<String> additions) {
        List<String> all = new ArrayList<>(defaults);
        all.addAll(additions);
        return all;
    }
}
