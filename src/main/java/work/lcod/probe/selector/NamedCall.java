package work.lcod.probe.selector;

import java.util.List;
import java.util.Objects;

public record NamedCall(NamePattern name, TagFilter tags, List<SelectorNode> children, Nesting nesting, boolean collapse)
        implements CallNode {
    public NamedCall {
        Objects.requireNonNull(name, "name");
        tags = tags == null ? TagFilter.NONE : tags;
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        nesting = Objects.requireNonNull(nesting, "nesting");
    }
}
