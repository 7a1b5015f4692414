package work.lcod.probe.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import work.lcod.probe.selector.Literal;
import work.lcod.probe.selector.NamePattern;
import work.lcod.probe.selector.Nesting;
import work.lcod.probe.selector.TagFilter;

/**
 * One node of a compiled selector. Call nodes are matched against scopes on enter,
 * the other kinds against bindings inside a matched call.
 */
public final class PatternNode {
    public enum Kind {
        CALL,
        VARIABLE,
        META,
        KEY
    }

    private final int id;
    private final int parentId;
    private final Kind kind;
    private final NamePattern name;
    private final TagFilter callTags;
    private final VariablePredicate predicate;
    private final Nesting nesting;
    private final boolean collapse;
    private final boolean focus;
    private final String captureName;
    private final Literal expected;
    private final boolean generic;
    private final List<PatternNode> children = new ArrayList<>();
    private boolean onFocusPath;

    PatternNode(int id, int parentId, Kind kind, NamePattern name, TagFilter callTags, VariablePredicate predicate,
                Nesting nesting, boolean collapse, boolean focus, String captureName, Literal expected, boolean generic) {
        this.id = id;
        this.parentId = parentId;
        this.kind = kind;
        this.name = name;
        this.callTags = callTags;
        this.predicate = predicate;
        this.nesting = nesting;
        this.collapse = collapse;
        this.focus = focus;
        this.captureName = captureName;
        this.expected = expected;
        this.generic = generic;
    }

    public int id() {
        return id;
    }

    /**
     * Id of the enclosing call node, {@code -1} for the root.
     */
    public int parentId() {
        return parentId;
    }

    public Kind kind() {
        return kind;
    }

    public NamePattern name() {
        return name;
    }

    public Nesting nesting() {
        return nesting;
    }

    public boolean collapse() {
        return collapse;
    }

    public boolean focus() {
        return focus;
    }

    public String captureName() {
        return captureName;
    }

    public Literal expected() {
        return expected;
    }

    public boolean generic() {
        return generic;
    }

    public List<PatternNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * True for call nodes that are ancestors of the focus. Each matching invocation of such a call
     * gets its own capture frame.
     */
    public boolean onFocusPath() {
        return onFocusPath;
    }

    void addChild(PatternNode child) {
        children.add(child);
    }

    void markOnFocusPath() {
        onFocusPath = true;
    }

    public boolean isCall() {
        return kind == Kind.CALL;
    }

    /**
     * Whether an override rule may replace the value bound to this node.
     */
    public boolean overridable() {
        return !generic;
    }

    public boolean matchesCall(FunctionRef function, Object key) {
        if (kind != Kind.CALL) {
            return false;
        }
        if (!matchesName(function)) {
            return false;
        }
        if (!callTags.test(function.tags())) {
            return false;
        }
        for (PatternNode child : children) {
            if (child.kind == Kind.KEY && child.expected != null && !child.expected.matches(key)) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesName(FunctionRef function) {
        if (name.kind() == NamePattern.Kind.ANY) {
            return true;
        }
        if (function.isUnknown()) {
            return false;
        }
        if (name.kind() == NamePattern.Kind.ABSOLUTE) {
            return name.matches(function.path());
        }
        return name.matches(function.name()) || name.matches(function.qualifiedName());
    }

    public boolean matchesBinding(String variableName, Set<String> tags) {
        return predicate != null && predicate.test(variableName, tags);
    }

    /**
     * Key under which a binding of {@code variableName} shows up in results.
     */
    public String exposedName(String variableName) {
        return captureName != null ? captureName : variableName;
    }

    /**
     * Capture key known before any event arrives, or {@code null} for unrenamed generic variables.
     */
    public String staticName() {
        if (captureName != null) {
            return captureName;
        }
        if (kind == Kind.VARIABLE && !generic) {
            return name.text();
        }
        if (kind == Kind.META) {
            return name.text();
        }
        return null;
    }

    @Override
    public String toString() {
        return "PatternNode[" + id + " " + kind + " " + (name == null ? "" : name.text()) + "]";
    }
}
