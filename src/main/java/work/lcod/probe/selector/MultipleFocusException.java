package work.lcod.probe.selector;

/**
 * A selector marked more than one variable with {@code !}.
 */
public final class MultipleFocusException extends SelectorException {
    private final int focusCount;

    public MultipleFocusException(String source, int focusCount) {
        super("multiple_focus", "Selector '" + source + "' has " + focusCount + " focus marks; at most one is allowed", source);
        this.focusCount = focusCount;
    }

    public int focusCount() {
        return focusCount;
    }
}
