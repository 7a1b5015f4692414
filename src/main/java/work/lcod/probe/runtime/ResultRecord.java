package work.lcod.probe.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.probe.selector.ProbeKind;

/**
 * One firing of a selector: capture name to value(s), shaped by the {@link ResultMode}.
 *
 * @param selectorId text of the selector that fired
 * @param focusName capture name of the focus, {@code null} for total firings
 * @param scopeId scope whose binding or exit triggered the firing
 * @param sequence engine-wide firing order
 */
public record ResultRecord(String selectorId, ProbeKind kind, ResultMode mode, String focusName,
                           Map<String, Object> values, long scopeId, long sequence) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ResultRecord {
        Objects.requireNonNull(selectorId, "selectorId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(mode, "mode");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Values of a capture as a list regardless of mode. Raw captures are unwrapped to their values.
     */
    public List<Object> all(String name) {
        Object value = values.get(name);
        if (!values.containsKey(name)) {
            return List.of();
        }
        if (mode == ResultMode.SINGLE) {
            return Collections.singletonList(value);
        }
        List<Object> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            out.add(item instanceof Capture capture ? capture.value() : item);
        }
        return out;
    }

    /**
     * The focus value of an immediate firing.
     *
     * @throws IllegalStateException when the record has no focus, or holds several focus values
     */
    public Object focusValue() {
        if (focusName == null) {
            throw new IllegalStateException("Selector '" + selectorId + "' has no focus");
        }
        List<Object> all = all(focusName);
        if (all.size() != 1) {
            throw new IllegalStateException("Focus '" + focusName + "' holds " + all.size() + " values");
        }
        return all.get(0);
    }

    /**
     * Same record without the focus entry, as passed to rewrite rules.
     */
    public Map<String, Object> valuesWithoutFocus() {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (focusName != null) {
            copy.remove(focusName);
        }
        return Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("selector", selectorId);
        serializable.put("kind", kind.name().toLowerCase());
        serializable.put("mode", mode.name().toLowerCase());
        serializable.put("scope", scopeId);
        serializable.put("sequence", sequence);
        if (focusName != null) {
            serializable.put("focus", focusName);
        }
        serializable.put("values", values);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
