package work.lcod.probe.selector;

/**
 * Malformed selector text. Raised while parsing, never while matching events.
 */
public final class SelectorSyntaxException extends SelectorException {
    private final int offset;

    public SelectorSyntaxException(String message, String source, int offset) {
        super("selector_syntax", message + " at offset " + offset + " in '" + source + "'", source);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
