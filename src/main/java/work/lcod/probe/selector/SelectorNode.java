package work.lcod.probe.selector;

/**
 * Canonical selector tree node. Produced by {@link SelectorParser}; two selectors mean the same
 * thing exactly when their canonical trees are equal.
 */
public interface SelectorNode {
    /**
     * Whether this node is the selector's focus.
     */
    default boolean focus() {
        return false;
    }

    /**
     * Name the capture is exposed under, or {@code null} to use the bound variable's own name.
     */
    default String rename() {
        return null;
    }
}
