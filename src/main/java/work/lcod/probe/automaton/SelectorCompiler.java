package work.lcod.probe.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.selector.CallNode;
import work.lcod.probe.selector.Indexed;
import work.lcod.probe.selector.MetaVariable;
import work.lcod.probe.selector.NamePattern;
import work.lcod.probe.selector.Nesting;
import work.lcod.probe.selector.Selector;
import work.lcod.probe.selector.SelectorNode;
import work.lcod.probe.selector.SelectorParser;
import work.lcod.probe.selector.TagFilter;
import work.lcod.probe.selector.Variable;

/**
 * Compiles selectors into {@link CompiledSelector} automata. Results are memoized by selector text;
 * compilation is pure, so concurrent compiles of the same text yield equal automata.
 */
public final class SelectorCompiler {
    private static final Logger logger = LoggerFactory.getLogger(SelectorCompiler.class);

    private final Map<String, CompiledSelector> cache = new ConcurrentHashMap<>();

    public CompiledSelector compile(String text) {
        CompiledSelector cached = cache.get(text);
        if (cached != null) {
            return cached;
        }
        return compile(SelectorParser.parse(text));
    }

    public CompiledSelector compile(Selector selector) {
        return cache.computeIfAbsent(selector.text(), key -> build(selector));
    }

    /**
     * Compiles every {@code ;}-separated selector in the text.
     */
    public List<CompiledSelector> compileAll(String text) {
        List<CompiledSelector> out = new ArrayList<>();
        for (Selector selector : SelectorParser.parseAll(text)) {
            out.add(compile(selector));
        }
        return out;
    }

    public int cachedCount() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    private static CompiledSelector build(Selector selector) {
        List<PatternNode> nodes = new ArrayList<>();
        PatternNode root = add(nodes, selector.root(), -1);
        PatternNode focus = null;
        for (PatternNode node : nodes) {
            if (node.focus()) {
                focus = node;
            }
        }
        if (focus != null) {
            int ancestor = focus.parentId();
            while (ancestor >= 0) {
                PatternNode call = nodes.get(ancestor);
                call.markOnFocusPath();
                ancestor = call.parentId();
            }
        }
        logger.debug("Compiled selector '{}' into {} nodes (root {})", selector.text(), nodes.size(), root);
        return new CompiledSelector(selector, nodes, focus);
    }

    private static PatternNode add(List<PatternNode> nodes, SelectorNode node, int parentId) {
        int id = nodes.size();
        PatternNode compiled;
        if (node instanceof CallNode call) {
            compiled = new PatternNode(id, parentId, PatternNode.Kind.CALL, call.name(), call.tags(), null,
                call.nesting(), call.collapse(), false, null, null, call.name().isGeneric());
            nodes.add(compiled);
            for (SelectorNode child : call.children()) {
                compiled.addChild(add(nodes, child, id));
            }
            return compiled;
        }
        if (node instanceof Variable variable) {
            compiled = new PatternNode(id, parentId, PatternNode.Kind.VARIABLE, variable.pattern(), TagFilter.NONE,
                VariablePredicate.of(variable.pattern(), variable.tagFilter()), Nesting.DIRECT, false,
                variable.focus(), variable.rename(), variable.expected(), variable.generic() || !variable.tagFilter().isEmpty());
        } else if (node instanceof MetaVariable meta) {
            NamePattern name = new NamePattern(NamePattern.Kind.EXACT, meta.kind().variableName());
            compiled = new PatternNode(id, parentId, PatternNode.Kind.META, name, TagFilter.NONE,
                new VariablePredicate.ByName(name), Nesting.DIRECT, false, meta.focus(), meta.rename(), meta.expected(), false);
        } else if (node instanceof Indexed indexed) {
            NamePattern name = new NamePattern(NamePattern.Kind.EXACT, "#key");
            compiled = new PatternNode(id, parentId, PatternNode.Kind.KEY, name, TagFilter.NONE, null,
                Nesting.DIRECT, false, false, indexed.rename(), indexed.key(), false);
        } else {
            throw new IllegalArgumentException("Unsupported selector node " + node);
        }
        nodes.add(compiled);
        return compiled;
    }
}
