package work.lcod.probe.manifest;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.probe.automaton.FunctionRef;

/**
 * Describes an instrumented function: its identity and the variables it binds.
 */
public final class FunctionManifest {
    private final String qualifiedName;
    private final String path;
    private final List<String> variables;
    private final List<String> tags;

    public FunctionManifest(String qualifiedName, String path, List<String> variables, List<String> tags) {
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        this.path = path;
        this.variables = variables == null ? List.of() : List.copyOf(variables);
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public String path() {
        return path;
    }

    public List<String> variables() {
        return variables;
    }

    public List<String> tags() {
        return tags;
    }

    public boolean declares(String variable) {
        return variables.contains(variable);
    }

    public FunctionRef toFunctionRef() {
        FunctionRef ref = FunctionRef.of(qualifiedName, Set.copyOf(tags));
        return path == null ? ref : new FunctionRef(ref.name(), ref.qualifiedName(), path, ref.tags());
    }
}
