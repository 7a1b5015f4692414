package work.lcod.probe.selector;

import java.util.List;

/**
 * A node matched against function scopes rather than bindings.
 */
public interface CallNode extends SelectorNode {
    NamePattern name();

    TagFilter tags();

    List<SelectorNode> children();

    /**
     * Relation to the enclosing call. Root calls are always {@link Nesting#DEEP} relative to the activation boundary.
     */
    Nesting nesting();

    /**
     * Whether this deep call may also coincide with its parent's own scope.
     */
    boolean collapse();
}
