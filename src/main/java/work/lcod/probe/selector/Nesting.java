package work.lcod.probe.selector;

/**
 * Whether a sub-call must be an immediate child of its parent call or any descendant.
 */
public enum Nesting {
    DIRECT,
    DEEP
}
