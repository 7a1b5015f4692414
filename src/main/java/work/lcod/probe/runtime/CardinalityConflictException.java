package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single-value result was requested but a capture holds several values.
 */
public final class CardinalityConflictException extends ProbeRuntimeException {
    private final String captureName;

    public CardinalityConflictException(String selectorId, String captureName, List<Object> values) {
        super("cardinality_conflict",
            "Capture '" + captureName + "' of selector '" + selectorId + "' holds " + values.size() + " values",
            Collections.unmodifiableList(new ArrayList<>(values)));
        this.captureName = captureName;
    }

    public String captureName() {
        return captureName;
    }

    @SuppressWarnings("unchecked")
    public List<Object> values() {
        return (List<Object>) data();
    }
}
