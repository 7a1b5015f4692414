package work.lcod.probe.runtime;

/**
 * Shape of the values in a {@link ResultRecord}.
 */
public enum ResultMode {
    /** One value per capture name. */
    SINGLE,
    /** All values of a capture name, in binding order. */
    POOLED,
    /** All {@link Capture}s of a capture name, with their scope ids. */
    RAW
}
