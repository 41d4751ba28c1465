package me.internalizable.honeymesh.persona.snapshot;

import javax.annotation.Nonnull;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * Glob patterns for paths left out of a snapshot.
 *
 * <p>Patterns are matched against virtual paths, i.e. "/"-separated paths
 * relative to the snapshot root. A pattern containing "/" is matched against
 * the whole virtual path ({@code /root/fs.pickle}); any other pattern is
 * matched against the entry name alone ({@code *.pickle}).</p>
 */
public final class ExclusionPolicy {

    /**
     * Patterns that keep snapshot artifacts and honeypot fingerprints out of a snapshot.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "/root/fs.pickle",
            "/root/createfs",
            "*.pickle",
            "*cowrie*",
            "*kippo*"
    );

    private static final ExclusionPolicy NONE = new ExclusionPolicy(List.of());
    private static final String GLOB_SPECIALS = "\\*?[]{}";

    private final List<String> patterns;
    private final List<Rule> rules;

    private ExclusionPolicy(List<String> patterns) {
        FileSystem fileSystem = FileSystems.getDefault();
        this.patterns = List.copyOf(patterns);
        this.rules = new ArrayList<>(patterns.size());
        for (String pattern : this.patterns) {
            try {
                rules.add(new Rule(pattern.indexOf('/') >= 0, fileSystem.getPathMatcher("glob:" + pattern)));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid exclusion glob '" + pattern + "': " + e.getDescription(), e);
            }
        }
    }

    @Nonnull
    public static ExclusionPolicy of(@Nonnull Collection<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        return new ExclusionPolicy(new ArrayList<>(patterns));
    }

    @Nonnull
    public static ExclusionPolicy defaults() {
        return of(DEFAULT_PATTERNS);
    }

    @Nonnull
    public static ExclusionPolicy none() {
        return NONE;
    }

    /**
     * Create a policy with additional patterns.
     *
     * @param more patterns to add
     * @return new policy; this one is unchanged
     */
    @Nonnull
    public ExclusionPolicy with(@Nonnull Collection<String> more) {
        Objects.requireNonNull(more, "more");
        List<String> combined = new ArrayList<>(patterns);
        for (String pattern : more) {
            if (!combined.contains(pattern)) {
                combined.add(pattern);
            }
        }
        return new ExclusionPolicy(combined);
    }

    /**
     * Quote a path so that it matches only itself when used as a pattern.
     *
     * @param path literal path
     * @return glob matching exactly {@code path}
     */
    @Nonnull
    public static String literal(@Nonnull String path) {
        Objects.requireNonNull(path, "path");
        StringBuilder glob = new StringBuilder(path.length());
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (GLOB_SPECIALS.indexOf(c) >= 0) {
                glob.append('\\');
            }
            glob.append(c);
        }
        return glob.toString();
    }

    /**
     * Check whether a virtual path is excluded.
     *
     * @param virtualPath "/"-prefixed path relative to the snapshot root
     * @return true if any pattern matches
     */
    public boolean matches(@Nonnull String virtualPath) {
        Objects.requireNonNull(virtualPath, "virtualPath");
        if (rules.isEmpty()) {
            return false;
        }
        Path path = Path.of(virtualPath);
        Path name = path.getFileName();
        for (Rule rule : rules) {
            Path subject = rule.wholePath() || name == null ? path : name;
            if (rule.matcher().matches(subject)) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    public List<String> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "ExclusionPolicy" + patterns;
    }

    private record Rule(boolean wholePath, PathMatcher matcher) {
    }
}
