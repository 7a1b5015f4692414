package work.lcod.probe.selector;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Name part of a selector element: an exact name, a {@code *} glob, or an absolute function path.
 */
public record NamePattern(Kind kind, String text) {
    public enum Kind {
        ANY,
        EXACT,
        GLOB,
        ABSOLUTE
    }

    public static final NamePattern ANY = new NamePattern(Kind.ANY, "*");

    private static final Map<String, Pattern> GLOBS = new ConcurrentHashMap<>();

    public NamePattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static NamePattern of(String text) {
        if ("*".equals(text)) {
            return ANY;
        }
        if (text.startsWith("/")) {
            return new NamePattern(Kind.ABSOLUTE, text);
        }
        if (text.indexOf('*') >= 0) {
            return new NamePattern(Kind.GLOB, text);
        }
        return new NamePattern(Kind.EXACT, text);
    }

    public boolean isGeneric() {
        return kind == Kind.ANY || kind == Kind.GLOB;
    }

    /**
     * Matches a plain name. Absolute patterns only match the identical path string.
     */
    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        return switch (kind) {
            case ANY -> true;
            case EXACT, ABSOLUTE -> text.equals(candidate);
            case GLOB -> GLOBS.computeIfAbsent(text, NamePattern::globRegex).matcher(candidate).matches();
        };
    }

    private static Pattern globRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
