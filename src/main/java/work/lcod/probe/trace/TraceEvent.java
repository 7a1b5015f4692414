package work.lcod.probe.trace;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded host event. Scopes are referred to by symbolic labels chosen by the trace author.
 *
 * @param scope label of the scope the event concerns (the new scope for {@code enter})
 * @param parent label of the calling scope for {@code enter}, or {@code null}
 * @param function function identity for {@code enter}: a qualified name or an absolute path
 * @param name variable name for {@code bind}
 * @param value bound, returned, yielded or received value; error message for {@code fail}
 * @param tags function tags for {@code enter}, variable tags for {@code bind}
 */
public record TraceEvent(Type type, String scope, String parent, String function, String name, Object value,
                         List<String> tags, Object key, boolean overridable) {
    public enum Type {
        ENTER,
        BIND,
        YIELD,
        RECEIVE,
        EXIT,
        FAIL;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<Type> fromKey(String key) {
            for (Type type : values()) {
                if (type.key().equals(key)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }
    }

    public TraceEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(scope, "scope");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
