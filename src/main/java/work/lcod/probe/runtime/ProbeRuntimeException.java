package work.lcod.probe.runtime;

/**
 * Runtime error carrying a stable code and optional structured data.
 */
public class ProbeRuntimeException extends RuntimeException {
    private final String code;
    private final Object data;

    public ProbeRuntimeException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
