package work.lcod.probe.selector;

/**
 * How results of a selector are delivered.
 */
public enum ProbeKind {
    /** Fires each time the focus variable is bound. */
    IMMEDIATE,
    /** Fires once, when the outermost matched call exits. */
    TOTAL
}
