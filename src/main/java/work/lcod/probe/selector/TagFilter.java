package work.lcod.probe.selector;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Tag constraint written {@code :A&B} (all of) or {@code :A|B} (any of).
 */
public record TagFilter(Set<String> tags, Combinator combinator) {
    public static final TagFilter NONE = new TagFilter(Set.of(), Combinator.ALL);

    public enum Combinator {
        ALL,
        ANY
    }

    public TagFilter {
        tags = Set.copyOf(new LinkedHashSet<>(Objects.requireNonNull(tags, "tags")));
        combinator = Objects.requireNonNull(combinator, "combinator");
    }

    public static TagFilter allOf(Collection<String> tags) {
        return new TagFilter(new LinkedHashSet<>(tags), Combinator.ALL);
    }

    public static TagFilter anyOf(Collection<String> tags) {
        return new TagFilter(new LinkedHashSet<>(tags), Combinator.ANY);
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public boolean test(Set<String> actual) {
        if (tags.isEmpty()) {
            return true;
        }
        Set<String> present = actual == null ? Set.of() : actual;
        if (combinator == Combinator.ALL) {
            return present.containsAll(tags);
        }
        for (String tag : tags) {
            if (present.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
