package work.lcod.probe.selector;

import java.util.Objects;

/**
 * A variable binding inside a call. {@code generic} is set when the name is {@code *} or a glob.
 *
 * @param expected value constraint from {@code =literal}, or {@code null}
 */
public record Variable(NamePattern pattern, TagFilter tagFilter, boolean focus, String rename, Literal expected)
        implements SelectorNode {
    public Variable {
        Objects.requireNonNull(pattern, "pattern");
        tagFilter = tagFilter == null ? TagFilter.NONE : tagFilter;
    }

    public boolean generic() {
        return pattern.isGeneric();
    }
}
