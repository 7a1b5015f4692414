package work.lcod.probe.automaton;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of a called function as reported by the host.
 *
 * @param name short name, e.g. {@code sing}
 * @param qualifiedName dotted owner-qualified name, e.g. {@code Elephant.sing}
 * @param path absolute path such as {@code /zoo.animals/Elephant/sing}, or {@code null}
 * @param tags category tags of the function
 */
public record FunctionRef(String name, String qualifiedName, String path, Set<String> tags) {
    /** A function the host cannot identify. Only {@code *} matches it. */
    public static final FunctionRef UNKNOWN = new FunctionRef(null, null, null, Set.of());

    public FunctionRef {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static FunctionRef of(String qualifiedName) {
        return of(qualifiedName, Set.of());
    }

    public static FunctionRef of(String qualifiedName, Set<String> tags) {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        if (qualifiedName.startsWith("/")) {
            return absolute(qualifiedName, tags);
        }
        int dot = qualifiedName.lastIndexOf('.');
        String name = dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
        return new FunctionRef(name, qualifiedName, null, tags);
    }

    /**
     * Builds a reference from {@code /module/Owner/name}: the last segment is the name and the
     * segments after the module form the qualified name.
     */
    public static FunctionRef absolute(String path, Set<String> tags) {
        Objects.requireNonNull(path, "path");
        String[] segments = path.substring(1).split("/");
        String name = segments[segments.length - 1];
        String qualified = segments.length > 1
            ? String.join(".", Arrays.asList(segments).subList(1, segments.length))
            : name;
        return new FunctionRef(name, qualified, path, tags);
    }

    public boolean isUnknown() {
        return name == null && qualifiedName == null && path == null;
    }

    public String displayName() {
        if (isUnknown()) {
            return "<unknown>";
        }
        return path != null ? path : qualifiedName;
    }
}
