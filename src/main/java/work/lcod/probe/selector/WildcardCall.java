package work.lcod.probe.selector;

import java.util.List;
import java.util.Objects;

/**
 * A call matching any function. The synthesized form of {@code a >> b} is a collapsing deep wildcard around {@code b}.
 */
public record WildcardCall(TagFilter tags, List<SelectorNode> children, Nesting nesting, boolean collapse)
        implements CallNode {
    public WildcardCall {
        tags = tags == null ? TagFilter.NONE : tags;
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        nesting = Objects.requireNonNull(nesting, "nesting");
    }

    @Override
    public NamePattern name() {
        return NamePattern.ANY;
    }
}
