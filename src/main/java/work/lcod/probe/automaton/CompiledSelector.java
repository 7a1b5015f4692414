package work.lcod.probe.automaton;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import work.lcod.probe.selector.NamePattern;
import work.lcod.probe.selector.ProbeKind;
import work.lcod.probe.selector.Selector;

/**
 * Immutable matching automaton for one selector. Shared by every activation of the same text.
 */
public final class CompiledSelector {
    private final Selector selector;
    private final List<PatternNode> nodes;
    private final PatternNode focus;

    CompiledSelector(Selector selector, List<PatternNode> nodes, PatternNode focus) {
        this.selector = selector;
        this.nodes = List.copyOf(nodes);
        this.focus = focus;
    }

    public Selector selector() {
        return selector;
    }

    public String text() {
        return selector.text();
    }

    public ProbeKind kind() {
        return selector.kind();
    }

    public PatternNode root() {
        return nodes.get(0);
    }

    public PatternNode node(int id) {
        return nodes.get(id);
    }

    public List<PatternNode> nodes() {
        return nodes;
    }

    /**
     * The focus node, or {@code null} for focus-less selectors.
     */
    public PatternNode focus() {
        return focus;
    }

    /**
     * Capture keys every firing reports, even when nothing was captured for them.
     */
    public Set<String> staticCaptureNames() {
        Set<String> names = new LinkedHashSet<>();
        for (PatternNode node : nodes) {
            String name = node.staticName();
            if (name != null && !node.isCall()) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Call nodes with a name or glob (not {@code *}), for diagnostics.
     */
    public List<PatternNode> namedCalls() {
        List<PatternNode> out = new ArrayList<>();
        for (PatternNode node : nodes) {
            if (node.isCall() && node.name().kind() != NamePattern.Kind.ANY) {
                out.add(node);
            }
        }
        return out;
    }
}
