package com.archlens.core.resolver;

import com.archlens.core.model.Dependency;
import com.archlens.core.model.EdgeKind;
import com.archlens.core.model.Language;
import com.archlens.core.model.Reference;
import com.archlens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps raw reference tokens onto project files.
 *
 * <p>Each token is tried against the following rules, first hit wins:
 * <ol>
 *   <li>Relative path: same-project tokens are joined with the referencing file's
 *       directory and tried as written, then with each supported extension appended</li>
 *   <li>Exact path: the token is a known project-relative path</li>
 *   <li>Fuzzy: a file's base name equals the token, or a file's path ends with
 *       {@code /<token>} or {@code /<token>.<ext>}; dotted module tokens such as
 *       {@code pkg.mod} are also tried as {@code pkg/mod}</li>
 *   <li>External: a plausible module name becomes a dependency on
 *       {@code external:<token>}</li>
 *   <li>Anything else is dropped</li>
 * </ol>
 *
 * <p>Self-references and repeated (from, to) pairs are dropped. Candidates are looked
 * up in a sorted {@link FileIndex}, so an ambiguous token always resolves to the
 * lexicographically first file.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final Pattern SCOPED_PACKAGE = Pattern.compile("@[\\w.-]+/[\\w.-]+");
    private static final Pattern MODULE_NAME = Pattern.compile("[\\w.@+-]+");
    private static final Pattern LEADING_RELATIVE_SEGMENTS = Pattern.compile("^(?:\\.{1,2}/)+");

    private final List<String> extensions;

    public ReferenceResolver() {
        this(Language.allExtensions());
    }

    /**
     * Creates a resolver trying the given extensions, in order, when a token has none.
     *
     * @param extensions extensions with leading dot
     */
    public ReferenceResolver(List<String> extensions) {
        this.extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions must not be null"));
    }

    /**
     * Resolves raw references against a set of project files.
     *
     * @param files project-relative paths of all known files
     * @param rawReferences references collected from the files' summaries
     * @return resolved dependencies and the external tokens they introduced
     */
    public ResolutionResult resolveDependencies(Collection<String> files, List<Reference> rawReferences) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(rawReferences, "rawReferences must not be null");
        return resolve(rawReferences, new FileIndex(files));
    }

    /**
     * Resolves raw references against a prepared index.
     *
     * @param rawReferences references to resolve
     * @param index sorted file index
     * @return resolved dependencies and external tokens
     */
    public ResolutionResult resolve(List<Reference> rawReferences, FileIndex index) {
        Set<String> seenEdges = new LinkedHashSet<>();
        Set<String> externalTokens = new LinkedHashSet<>();
        List<Dependency> dependencies = new ArrayList<>();
        int dropped = 0;

        for (Reference reference : rawReferences) {
            String from = FileUtils.normalize(reference.sourceFile());
            String token = reference.target().trim();
            if (token.isEmpty()) {
                dropped++;
                continue;
            }

            Optional<String> target = resolveToFile(from, token, reference.local(), index);
            String to;
            if (target.isPresent()) {
                to = target.get();
                if (to.equals(from)) {
                    log.debug("Dropping self-reference {} in {}", token, from);
                    dropped++;
                    continue;
                }
            } else if (isPlausibleModule(token)) {
                to = Dependency.EXTERNAL_PREFIX + token;
                externalTokens.add(token);
            } else {
                log.debug("Dropping unresolved reference {} in {}", token, from);
                dropped++;
                continue;
            }

            if (seenEdges.add(from + "\u0000" + to)) {
                String label = reference.kind() == null ? null : reference.kind().name().toLowerCase(Locale.ROOT);
                dependencies.add(new Dependency(from, to, EdgeKind.DEPENDENCY, label));
            }
        }

        log.info("Resolved {} references into {} dependencies ({} external modules, {} dropped)",
            rawReferences.size(), dependencies.size(), externalTokens.size(), dropped);
        return new ResolutionResult(dependencies, new ArrayList<>(externalTokens));
    }

    private Optional<String> resolveToFile(String from, String token, boolean local, FileIndex index) {
        String normalizedToken = FileUtils.normalize(token);

        if (local || token.startsWith(".")) {
            Optional<String> relative = resolveRelative(FileUtils.parentOf(from), normalizedToken, index);
            if (relative.isPresent()) {
                return relative;
            }
        }

        String exact = normalizedToken.startsWith("/") ? normalizedToken.substring(1) : normalizedToken;
        if (index.contains(exact)) {
            return Optional.of(exact);
        }

        Optional<String> fuzzy = resolveFuzzy(from, exact, index);
        if (fuzzy.isPresent()) {
            return fuzzy;
        }
        if (isDottedModule(exact)) {
            return resolveFuzzy(from, exact.replace('.', '/'), index);
        }
        return Optional.empty();
    }

    private Optional<String> resolveRelative(String directory, String token, FileIndex index) {
        String base = token.startsWith("/") ? FileUtils.join(".", token) : FileUtils.join(directory, token);
        if (base == null || base.isEmpty()) {
            return Optional.empty();
        }
        if (index.contains(base)) {
            return Optional.of(base);
        }
        for (String extension : extensions) {
            if (index.contains(base + extension)) {
                return Optional.of(base + extension);
            }
        }
        return Optional.empty();
    }

    private Optional<String> resolveFuzzy(String from, String token, FileIndex index) {
        String stripped = LEADING_RELATIVE_SEGMENTS.matcher(token).replaceFirst("");
        if (stripped.isEmpty()) {
            return Optional.empty();
        }

        if (!stripped.contains("/")) {
            for (String candidate : index.findByBaseName(stripped)) {
                if (!candidate.equals(from)) {
                    return Optional.of(candidate);
                }
            }
        }

        Optional<String> asWritten = index.findFirstBySuffix(stripped, from);
        if (asWritten.isPresent()) {
            return asWritten;
        }
        for (String extension : extensions) {
            Optional<String> withExtension = index.findFirstBySuffix(stripped + extension, from);
            if (withExtension.isPresent()) {
                return withExtension;
            }
        }
        return Optional.empty();
    }

    private boolean isDottedModule(String token) {
        return token.indexOf('.') > 0
            && !token.contains("/")
            && Language.fromPath(token) == Language.UNKNOWN;
    }

    /**
     * Checks whether an unresolved token can name an external module.
     *
     * @param token reference token
     * @return true for non-empty tokens without path separators, or scoped npm packages
     */
    static boolean isPlausibleModule(String token) {
        if (token.isEmpty() || token.startsWith(".")) {
            return false;
        }
        if (SCOPED_PACKAGE.matcher(token).matches()) {
            return true;
        }
        return !token.contains("/") && !token.contains("\\") && MODULE_NAME.matcher(token).matches();
    }
}
