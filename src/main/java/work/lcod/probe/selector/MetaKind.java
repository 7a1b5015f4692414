package work.lcod.probe.selector;

import java.util.Locale;
import java.util.Optional;

/**
 * Synthetic variables bound by the scope tracker on lifecycle events.
 */
public enum MetaKind {
    ENTER("#enter"),
    VALUE("#value"),
    YIELD("#yield"),
    RECEIVE("#receive"),
    EXIT("#exit"),
    ERROR("#error"),
    KEY("#key");

    private final String variableName;

    MetaKind(String variableName) {
        this.variableName = variableName;
    }

    /**
     * Name under which the tracker binds this meta variable, including the leading {@code #}.
     */
    public String variableName() {
        return variableName;
    }

    public static Optional<MetaKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String bare = name.startsWith("#") ? name.substring(1) : name;
        for (MetaKind kind : values()) {
            if (kind.name().toLowerCase(Locale.ROOT).equals(bare)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
