package work.lcod.probe.selector;

/**
 * Base exception for selector errors. Carries a stable error code alongside the message.
 */
public class SelectorException extends RuntimeException {
    private final String code;
    private final String source;

    public SelectorException(String code, String message, String source) {
        super(message);
        this.code = code;
        this.source = source;
    }

    public String code() {
        return code;
    }

    /**
     * The selector text being processed when the error was raised.
     */
    public String source() {
        return source;
    }
}
