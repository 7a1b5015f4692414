package work.lcod.probe.runtime;

/**
 * What happens when more than one override rule targets the same binding.
 */
public enum OverrideConflictPolicy {
    /** The most recently registered rule decides. */
    LAST_WINS,
    /** A second rule on one probe is refused; rules from different probes acting on one binding leave it unchanged. */
    ERROR
}
