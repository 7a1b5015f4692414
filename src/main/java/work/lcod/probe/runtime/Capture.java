package work.lcod.probe.runtime;

/**
 * A value recorded for a selector variable.
 *
 * @param scopeId scope the binding happened in
 * @param variable actual variable name of the binding
 * @param value bound value (after any substitution)
 * @param sequence global recording order
 */
public record Capture(long scopeId, String variable, Object value, long sequence) {
    Capture withValue(Object newValue) {
        return new Capture(scopeId, variable, newValue, sequence);
    }
}
