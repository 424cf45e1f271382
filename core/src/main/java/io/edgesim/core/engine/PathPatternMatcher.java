package io.edgesim.core.engine;

import io.edgesim.core.error.InvalidPatternException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Compiles glob-style behavior path patterns into anchored matchers.
 *
 * <p>
 * Supported syntax:
 * <ul>
 * <li>{@code *} matches any run of characters, including {@code /} and the
 * empty run: {@code /api/*} matches {@code /api/}, {@code /api/users} and
 * {@code /api/users/42}</li>
 * <li>every other character is literal</li>
 * </ul>
 * Patterns are anchored: {@code /api/*} does not match {@code /other/api/x}.
 * The bare pattern {@code *} is the catch-all. The only other patterns that
 * may start with {@code *} are extension suffixes such as {@code *.png}.
 *
 * <p>
 * Compilation is side-effect free and cached per distinct pattern string.
 * Thread-safe.
 */
public final class PathPatternMatcher {

    /** The catch-all pattern. */
    public static final String CATCH_ALL = "*";

    private static final Map<String, Matcher> CACHE = new ConcurrentHashMap<>();

    private static final Pattern EXTENSION_SUFFIX = Pattern.compile("\\*\\.[^/*]+");

    private PathPatternMatcher() {}

    /**
     * Compiles {@code pattern}, reusing a previously compiled matcher for the same
     * string.
     *
     * @throws InvalidPatternException if the pattern is blank, contains whitespace
     *                                 or control characters, or is neither the
     *                                 catch-all, an extension suffix nor an
     *                                 absolute path
     */
    public static Matcher compile(String pattern) {
        validate(pattern);
        return CACHE.computeIfAbsent(pattern, p -> new Matcher(p, toRegex(p)));
    }

    /** Number of distinct patterns compiled so far. */
    static int cachedCount() {
        return CACHE.size();
    }

    private static void validate(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException("Path pattern must not be empty", pattern);
        }
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidPatternException(
                        "Path pattern contains whitespace or control character at index " + i + ": '" + pattern + "'",
                        pattern);
            }
        }
        if (!pattern.startsWith("/") && !pattern.startsWith(CATCH_ALL)) {
            throw new InvalidPatternException("Path pattern must start with '/' or '*': '" + pattern + "'", pattern);
        }
        // a leading wildcard is only the catch-all or an extension suffix such as *.png
        if (pattern.startsWith(CATCH_ALL)
                && !CATCH_ALL.equals(pattern)
                && !EXTENSION_SUFFIX.matcher(pattern).matches()) {
            throw new InvalidPatternException(
                    "Path pattern starting with '*' must be '*' or '*.<ext>': '" + pattern + "'", pattern);
        }
    }

    private static Pattern toRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        int literalStart = 0;
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) == '*') {
                if (i > literalStart) {
                    regex.append(Pattern.quote(pattern.substring(literalStart, i)));
                }
                regex.append(".*");
                literalStart = i + 1;
            }
        }
        if (literalStart < pattern.length()) {
            regex.append(Pattern.quote(pattern.substring(literalStart)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /** A compiled, immutable path pattern. */
    public static final class Matcher {

        private final String pattern;
        private final Pattern regex;

        private Matcher(String pattern, Pattern regex) {
            this.pattern = pattern;
            this.regex = regex;
        }

        /** True if the whole of {@code path} matches the pattern. */
        public boolean matches(String path) {
            if (path == null) {
                return false;
            }
            if (pattern.equals(path)) {
                return true; // Exact match fast path
            }
            return regex.matcher(path).matches();
        }

        /** The source pattern. */
        public String pattern() {
            return pattern;
        }

        /** True for the bare {@code *} pattern. */
        public boolean isCatchAll() {
            return CATCH_ALL.equals(pattern);
        }

        @Override
        public String toString() {
            return "Matcher[" + pattern + "]";
        }
    }
}
