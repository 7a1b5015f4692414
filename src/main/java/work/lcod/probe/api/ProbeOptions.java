package work.lcod.probe.api;

import work.lcod.probe.runtime.ResultMode;
import work.lcod.probe.selector.ProbeKind;

/**
 * Per-probe delivery options. {@code null} fields use the defaults: the kind implied by the
 * selector, {@link ResultMode#SINGLE} for immediate and {@link ResultMode#POOLED} for total probes.
 */
public record ProbeOptions(ProbeKind kind, ResultMode mode) {
    public static ProbeOptions defaults() {
        return new ProbeOptions(null, null);
    }

    public static ProbeOptions mode(ResultMode mode) {
        return new ProbeOptions(null, mode);
    }

    public ProbeOptions withKind(ProbeKind newKind) {
        return new ProbeOptions(newKind, mode);
    }

    public ProbeOptions withMode(ResultMode newMode) {
        return new ProbeOptions(kind, newMode);
    }
}
