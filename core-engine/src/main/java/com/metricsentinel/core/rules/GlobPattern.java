package com.metricsentinel.core.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Case-sensitive shell-style glob, compiled to a regular expression.
 *
 * <p>
 * Supported syntax: {@code *} (any run of characters, {@code '/'} and
 * {@code '#'} included), {@code ?} (any single character), and bracket sets
 * {@code [abc]}, {@code [a-z]}, {@code [!abc]}. An unterminated {@code [} is
 * matched literally. Every other character matches itself.
 * </p>
 *
 * @since 1.0.0
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * @param glob the glob text; must not be {@code null}
     * @return the compiled pattern
     */
    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "Glob must not be null");
        return new GlobPattern(glob, Pattern.compile(translate(glob), Pattern.DOTALL));
    }

    /**
     * @param text candidate string
     * @return {@code true} if the whole of {@code text} matches
     */
    public boolean matches(String text) {
        return regex.matcher(text).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String translate(String glob) {
        StringBuilder re = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> re.append(".*");
                case '?' -> re.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && glob.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && glob.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        re.append("\\[");
                    } else {
                        String set = glob.substring(i, j)
                                .replace("\\", "\\\\")
                                .replace("[", "\\[")
                                .replace("&", "\\&")
                                .replace("]", "\\]");
                        i = j + 1;
                        if (set.startsWith("!")) {
                            set = "^" + set.substring(1);
                        } else if (set.startsWith("^")) {
                            set = "\\" + set;
                        }
                        re.append('[').append(set).append(']');
                    }
                }
                default -> {
                    if (Character.isLetterOrDigit(c) || c == '_') {
                        re.append(c);
                    } else {
                        re.append(Pattern.quote(String.valueOf(c)));
                    }
                }
            }
        }
        return re.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GlobPattern that))
            return false;
        return glob.equals(that.glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return glob;
    }
}
