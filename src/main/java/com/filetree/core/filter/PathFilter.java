package com.filetree.core.filter;

import com.filetree.config.ExportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a filesystem entry under the root is left out of the tree.
 * <p>
 * Each exclude pattern is a {@link ShellPattern} tested against every
 * root-relative segment name and every root-relative prefix of the path, with
 * {@code /} separators (e.g. {@code src}, {@code src/gen},
 * {@code src/gen/A.java}). A match on any ancestor therefore excludes the whole
 * subtree beneath it. {@code *} also matches across {@code /}.
 */
public class PathFilter {

    private static final Logger log = LoggerFactory.getLogger(PathFilter.class);

    private final Path root;
    private final List<String> patterns;
    private final List<ShellPattern> matchers;
    private final boolean includeHidden;

    /** Patterns that do not compile are logged and ignored. */
    public PathFilter(Path root, List<String> patterns, boolean includeHidden) {
        this.root = root.toAbsolutePath().normalize();
        this.patterns = List.copyOf(patterns);
        this.matchers = compile(this.patterns);
        this.includeHidden = includeHidden;
    }

    public PathFilter(ExportSettings settings) {
        this(settings.root(), settings.excludes(), settings.includeHidden());
    }

    /**
     * Returns {@code true} if {@code path} should not appear in the tree or the document.
     * The root itself is never excluded by pattern.
     */
    public boolean shouldSkip(Path path) {
        if (!includeHidden && isHidden(path)) {
            return true;
        }
        return !normalize(path).equals(root) && isExcludedByPattern(path);
    }

    /**
     * Returns {@code true} if the path or any of its ancestors below the root
     * matches an exclude pattern, by segment name or by root-relative subpath.
     */
    public boolean isExcludedByPattern(Path path) {
        Path relative = relativize(path);
        if (relative == null || matchers.isEmpty()) {
            return false;
        }
        int count = relative.getNameCount();
        StringBuilder subpath = new StringBuilder();
        for (int i = 0; i < count; i++) {
            String segment = relative.getName(i).toString();
            if (i > 0) {
                subpath.append('/');
            }
            subpath.append(segment);
            for (ShellPattern matcher : matchers) {
                if (matcher.matches(segment) || matcher.matches(subpath.toString())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if any root-relative segment starts with a dot.
     * Segments above the root are not considered.
     */
    public boolean isHidden(Path path) {
        Path relative = relativize(path);
        if (relative == null) {
            return false;
        }
        for (Path part : relative) {
            String name = part.toString();
            if (!".".equals(name) && name.startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    public Path root() {
        return root;
    }

    public List<String> patterns() {
        return patterns;
    }

    public boolean includeHidden() {
        return includeHidden;
    }

    private static List<ShellPattern> compile(List<String> patterns) {
        List<ShellPattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                compiled.add(ShellPattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid exclude pattern '{}': {}", pattern, e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    /** Root-relative form of {@code path}, or {@code null} for the root or paths outside it. */
    private Path relativize(Path path) {
        Path normalized = normalize(path);
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            return null;
        }
        return root.relativize(normalized);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
