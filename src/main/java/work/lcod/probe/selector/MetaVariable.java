package work.lcod.probe.selector;

import java.util.Objects;

public record MetaVariable(MetaKind kind, boolean focus, String rename, Literal expected) implements SelectorNode {
    public MetaVariable {
        Objects.requireNonNull(kind, "kind");
        if (kind == MetaKind.KEY) {
            throw new IllegalArgumentException("#key is represented by Indexed");
        }
    }
}
