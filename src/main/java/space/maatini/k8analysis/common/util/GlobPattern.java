package space.maatini.k8analysis.common.util;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching over object keys.
 * <p>
 * Object keys have no real directories, so {@code *} also matches {@code /}. {@code ?} matches
 * one character and {@code [...]} a character class ({@code [!...]} negated).
 */
public final class GlobPattern {

    private final Pattern pattern;

    private GlobPattern(String glob) {
        this.pattern = Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob);
    }

    /**
     * The part of the glob before the first wildcard, usable as a listing prefix.
     */
    public static String literalPrefix(String glob) {
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?' || c == '[') {
                return glob.substring(0, i);
            }
        }
        return glob;
    }

    public boolean matches(String value) {
        return pattern.matcher(value).matches();
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
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
                    // unterminated class is a literal bracket
                    regex.append("\\[");
                } else {
                    String body = glob.substring(i, j).replace("\\", "\\\\");
                    i = j + 1;
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    } else if (body.startsWith("^")) {
                        body = "\\" + body;
                    }
                    regex.append('[').append(body).append(']');
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
