package work.lcod.probe.runtime;

/**
 * Replacement value the host must use instead of the one it bound. The value may be {@code null}.
 */
public record Substitution(Object value) {}
