package ai.depgraph.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Glob-based exclusion of manifest paths.
 * <p>
 * Glob syntax: {@code **} any characters including '/', {@code *} any characters except '/',
 * {@code ?} one character except '/'. A pattern excludes a manifest if it matches the whole
 * string or the last segment of any of: the absolute manifest path, the path relative to the
 * working directory, or the enclosing directory in either form.
 */
public final class ExclusionMatcher {

    private final List<Pattern> patterns;
    private final Path workingDir;

    public ExclusionMatcher(List<String> globs, Path workingDir) {
        Objects.requireNonNull(globs, "globs");
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir").toAbsolutePath().normalize();
        final List<Pattern> compiled = new ArrayList<>(globs.size());
        for (String glob : globs) {
            if (glob != null && !glob.isBlank()) {
                compiled.add(toRegex(glob.trim()));
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    public static ExclusionMatcher none() {
        return new ExclusionMatcher(List.of(), Path.of(""));
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public boolean shouldExclude(Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath");
        if (patterns.isEmpty()) {
            return false;
        }
        final Path absolute = manifestPath.toAbsolutePath().normalize();
        final Path relative = workingDir.relativize(absolute);
        final Path absoluteDir = absolute.getParent();
        final Path relativeDir = relative.getParent();

        for (Pattern p : patterns) {
            if (matches(p, absolute) || matches(p, relative)
                    || matches(p, absoluteDir) || matches(p, relativeDir)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Pattern pattern, Path path) {
        if (path == null) {
            return false;
        }
        final String full = slashes(path.toString());
        if (pattern.matcher(full).matches()) {
            return true;
        }
        final Path name = path.getFileName();
        return name != null && pattern.matcher(name.toString()).matches();
    }

    static Pattern toRegex(String glob) {
        final String g = slashes(glob);
        final StringBuilder sb = new StringBuilder(g.length() * 2);
        for (int i = 0; i < g.length(); i++) {
            final char c = g.charAt(i);
            if (c == '*') {
                if (i + 1 < g.length() && g.charAt(i + 1) == '*') {
                    sb.append(".*");
                    i++;
                } else {
                    sb.append("[^/]*");
                }
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }

    private static String slashes(String s) {
        return s.replace('\\', '/');
    }
}
