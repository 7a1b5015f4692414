package work.lcod.probe.automaton;

import java.util.Objects;
import java.util.Set;
import work.lcod.probe.selector.NamePattern;
import work.lcod.probe.selector.TagFilter;

/**
 * Decides whether a binding event concerns a selector variable.
 * Names starting with {@code #} are meta variables and are only matched by name.
 */
public interface VariablePredicate {
    boolean test(String variableName, Set<String> variableTags);

    static VariablePredicate of(NamePattern pattern, TagFilter tags) {
        if (!tags.isEmpty()) {
            return new ByTag(pattern, tags);
        }
        if (pattern.kind() == NamePattern.Kind.ANY) {
            return new Any();
        }
        return new ByName(pattern);
    }

    record ByName(NamePattern pattern) implements VariablePredicate {
        public ByName {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean test(String variableName, Set<String> variableTags) {
            if (isMeta(variableName) && pattern.kind() != NamePattern.Kind.EXACT) {
                return false;
            }
            return pattern.matches(variableName);
        }
    }

    record ByTag(NamePattern pattern, TagFilter tags) implements VariablePredicate {
        public ByTag {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(tags, "tags");
        }

        @Override
        public boolean test(String variableName, Set<String> variableTags) {
            return !isMeta(variableName) && pattern.matches(variableName) && tags.test(variableTags);
        }
    }

    record Any() implements VariablePredicate {
        @Override
        public boolean test(String variableName, Set<String> variableTags) {
            return !isMeta(variableName);
        }
    }

    private static boolean isMeta(String variableName) {
        return variableName != null && variableName.startsWith("#");
    }
}
