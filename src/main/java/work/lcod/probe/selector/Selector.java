package work.lcod.probe.selector;

import java.util.Objects;

/**
 * A parsed selector: its source text, canonical tree and the probe kind the tree implies.
 */
public record Selector(String text, CallNode root, ProbeKind kind) {
    public Selector {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Canonical rendering; reparsing it yields an equal tree.
     */
    public String canonicalText() {
        return SelectorPrinter.print(root);
    }
}
