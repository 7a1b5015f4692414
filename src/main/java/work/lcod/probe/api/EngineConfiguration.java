package work.lcod.probe.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.lcod.probe.runtime.OverrideConflictPolicy;

/**
 * Immutable configuration of a {@link ProbeEngine}.
 *
 * @param maxPooledCaptures upper bound of captures kept per selector variable, {@code 0} for unbounded
 * @param warnOnUnresolved log unresolved selector references as warnings
 * @param fairLock use a fair event lock
 * @param manifests function manifest files loaded into the engine's catalog
 */
public record EngineConfiguration(
    OverrideConflictPolicy overrideConflictPolicy,
    int maxPooledCaptures,
    boolean warnOnUnresolved,
    boolean fairLock,
    List<Path> manifests
) {
    public EngineConfiguration {
        Objects.requireNonNull(overrideConflictPolicy, "overrideConflictPolicy");
        if (maxPooledCaptures < 0) {
            throw new IllegalArgumentException("maxPooledCaptures must be >= 0");
        }
        manifests = manifests == null ? List.of() : List.copyOf(manifests);
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .overrideConflictPolicy(overrideConflictPolicy)
            .maxPooledCaptures(maxPooledCaptures)
            .warnOnUnresolved(warnOnUnresolved)
            .fairLock(fairLock)
            .manifests(manifests);
    }

    public static final class Builder {
        private OverrideConflictPolicy overrideConflictPolicy = OverrideConflictPolicy.LAST_WINS;
        private int maxPooledCaptures;
        private boolean warnOnUnresolved = true;
        private boolean fairLock;
        private List<Path> manifests = List.of();

        public Builder overrideConflictPolicy(OverrideConflictPolicy overrideConflictPolicy) {
            this.overrideConflictPolicy = overrideConflictPolicy;
            return this;
        }

        public Builder maxPooledCaptures(int maxPooledCaptures) {
            this.maxPooledCaptures = maxPooledCaptures;
            return this;
        }

        public Builder warnOnUnresolved(boolean warnOnUnresolved) {
            this.warnOnUnresolved = warnOnUnresolved;
            return this;
        }

        public Builder fairLock(boolean fairLock) {
            this.fairLock = fairLock;
            return this;
        }

        public Builder manifests(List<Path> manifests) {
            this.manifests = manifests;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                overrideConflictPolicy,
                maxPooledCaptures,
                warnOnUnresolved,
                fairLock,
                manifests
            );
        }
    }
}
