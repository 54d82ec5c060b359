package com.featureforge.coordinator.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists and reads files of a target repository.
 *
 * The listing skips version-control metadata, build caches and secrets
 * (see {@link #DEFAULT_IGNORES}) plus whatever the target's top-level
 * .gitignore names. Only the simple .gitignore forms are understood:
 * globs, a trailing "/" for directories and a leading "/" to anchor at the
 * root. Negated patterns ("!foo") are skipped.
 */
@Component
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    static final List<String> DEFAULT_IGNORES = List.of(
            ".git/",
            "__pycache__/",
            "*.pyc",
            "node_modules/",
            ".DS_Store",
            ".env",
            "*.db",
            "*.sqlite",
            "*.sqlite3",
            "*.log"
    );

    /**
     * Sorted, newline-separated relative paths of every non-ignored file.
     * This is the repository structure handed to the planner.
     */
    public String structure(Path root) {
        return String.join("\n", listFiles(root));
    }

    /** Sorted relative paths (forward slashes) of every non-ignored regular file under root. */
    public List<String> listFiles(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<IgnoreRule> rules = rulesFor(root);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> toRelative(root, p))
                    .filter(rel -> rules.stream().noneMatch(r -> r.matches(rel)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + root, e);
        }
    }

    /**
     * Current content of those {@code relativePaths} that exist under root.
     * Missing files are left out (the chunk will create them). Paths that
     * resolve outside root and files that are not UTF-8 text are rejected
     * with IllegalArgumentException; reading them again would fail the same way.
     */
    public Map<String, String> readExisting(Path root, Collection<String> relativePaths) {
        Path base = root.toAbsolutePath().normalize();
        Map<String, String> contents = new LinkedHashMap<>();
        for (String rel : relativePaths) {
            Path file = base.resolve(rel).normalize();
            if (!file.startsWith(base)) {
                throw new IllegalArgumentException("Path escapes the target directory: " + rel);
            }
            if (!Files.isRegularFile(file)) continue;
            try {
                contents.put(rel, Files.readString(file, StandardCharsets.UTF_8));
            } catch (CharacterCodingException e) {
                throw new IllegalArgumentException("Not a UTF-8 text file: " + rel, e);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read " + file, e);
            }
        }
        return contents;
    }

    // ------------------------------------------------------------------
    // Ignore rules
    // ------------------------------------------------------------------

    private List<IgnoreRule> rulesFor(Path root) {
        List<String> patterns = new ArrayList<>(DEFAULT_IGNORES);
        Path gitignore = root.resolve(".gitignore");
        if (Files.isRegularFile(gitignore)) {
            try {
                Files.readAllLines(gitignore, StandardCharsets.UTF_8).stream()
                        .map(String::trim)
                        .filter(line -> !line.isEmpty() && !line.startsWith("#") && !line.startsWith("!"))
                        .forEach(patterns::add);
            } catch (IOException e) {
                log.warn("Could not read {}: {}. Using default ignores only.", gitignore, e.getMessage());
            }
        }
        return patterns.stream().map(IgnoreRule::parse).collect(Collectors.toList());
    }

    private static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /** One .gitignore-style pattern. */
    record IgnoreRule(PathMatcher matcher, boolean directoryOnly, boolean anchored) {

        static IgnoreRule parse(String pattern) {
            boolean dirOnly = pattern.endsWith("/");
            String p = dirOnly ? pattern.substring(0, pattern.length() - 1) : pattern;
            boolean anchored = p.startsWith("/") || p.contains("/");
            if (p.startsWith("/")) p = p.substring(1);
            return new IgnoreRule(FileSystems.getDefault().getPathMatcher("glob:" + p), dirOnly, anchored);
        }

        boolean matches(String relativePath) {
            String[] segments = relativePath.split("/");
            // Directory segments exclude the file name itself.
            int dirCount = segments.length - 1;

            if (anchored) {
                StringBuilder prefix = new StringBuilder();
                for (int i = 0; i < segments.length; i++) {
                    if (i > 0) prefix.append('/');
                    prefix.append(segments[i]);
                    boolean isDir = i < dirCount;
                    if ((isDir || !directoryOnly) && matcher.matches(Path.of(prefix.toString()))) {
                        return true;
                    }
                }
                return false;
            }

            int limit = directoryOnly ? dirCount : segments.length;
            for (int i = 0; i < limit; i++) {
                if (matcher.matches(Path.of(segments[i]))) return true;
            }
            return false;
        }
    }
}
