package work.lcod.probe.runtime;

/**
 * A second override rule was registered while the conflict policy is {@link OverrideConflictPolicy#ERROR}.
 */
public final class OverrideConflictException extends ProbeRuntimeException {
    public OverrideConflictException(String selectorId) {
        super("override_conflict", "Selector '" + selectorId + "' already has an override rule", selectorId);
    }
}
