package work.lcod.probe.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands surface shorthand into canonical nodes.
 *
 * <ul>
 *   <li>a bare variable {@code a} becomes {@code *{!a}}</li>
 *   <li>{@code a > b} becomes {@code a{b}} and {@code a >> b} becomes {@code a{>> b}}</li>
 *   <li>a deep variable {@code {>> b}} is wrapped in a collapsing deep wildcard call</li>
 *   <li>{@code f[k]} becomes an {@link Indexed} child, same as {@code f{#key=k}}</li>
 *   <li>{@code f{..} as r} adds {@code #value as r}; {@code !f{..}} focuses {@code #value}</li>
 *   <li>the terminal variable of a top-level chain is the focus when nothing is marked with {@code !}</li>
 * </ul>
 */
final class SelectorNormalizer {
    private final String source;

    private SelectorNormalizer(String source) {
        this.source = source;
    }

    static Selector normalize(Surface.Node node, String source) {
        int marks = countFocusMarks(node);
        if (marks > 1) {
            throw new MultipleFocusException(source, marks);
        }
        SelectorNormalizer normalizer = new SelectorNormalizer(source);
        CallNode root = normalizer.root(node, marks == 0);
        ProbeKind kind = containsFocus(root) ? ProbeKind.IMMEDIATE : ProbeKind.TOTAL;
        return new Selector(source, root, kind);
    }

    private CallNode root(Surface.Node node, boolean implicitFocus) {
        if (node instanceof Surface.Nest nest) {
            Surface.Element head = requireCallHead(nest.parent());
            List<SelectorNode> children = callChildren(head);
            attach(children, nest.child(), nest.deep(), implicitFocus);
            return call(head, children, Nesting.DEEP, false);
        }
        Surface.Element element = (Surface.Element) node;
        if (element.callLike()) {
            return call(element, callChildren(element), Nesting.DEEP, false);
        }
        // A lone variable matches in any call.
        List<SelectorNode> children = new ArrayList<>();
        children.add(variable(element, element.focus || implicitFocus));
        return new WildcardCall(TagFilter.NONE, children, Nesting.DEEP, false);
    }

    private void attach(List<SelectorNode> siblings, Surface.Node node, boolean deep, boolean implicitFocus) {
        Nesting nesting = deep ? Nesting.DEEP : Nesting.DIRECT;
        if (node instanceof Surface.Nest nest) {
            Surface.Element head = requireCallHead(nest.parent());
            List<SelectorNode> children = callChildren(head);
            attach(children, nest.child(), nest.deep(), implicitFocus);
            siblings.add(call(head, children, nesting, false));
            return;
        }
        Surface.Element element = (Surface.Element) node;
        if (element.callLike()) {
            siblings.add(call(element, callChildren(element), nesting, false));
            return;
        }
        SelectorNode variable = variable(element, element.focus || implicitFocus);
        if (deep) {
            if (variable instanceof Indexed) {
                throw new SelectorSyntaxException("#key cannot be matched in a nested call", source, element.offset());
            }
            siblings.add(new WildcardCall(TagFilter.NONE, List.of(variable), Nesting.DEEP, true));
        } else {
            siblings.add(variable);
        }
    }

    private List<SelectorNode> callChildren(Surface.Element element) {
        List<SelectorNode> children = new ArrayList<>();
        if (element.key != null) {
            children.add(new Indexed(element.key.literal(), element.key.capture()));
        }
        if (element.group != null) {
            for (Surface.Entry entry : element.group) {
                attach(children, entry.node(), entry.deep(), false);
            }
        }
        return children;
    }

    private CallNode call(Surface.Element element, List<SelectorNode> children, Nesting nesting, boolean collapse) {
        if (element.kind == Surface.ElementKind.META || element.dollar) {
            throw new SelectorSyntaxException("'" + describe(element) + "' cannot be used as a call", source, element.offset());
        }
        if (element.expected != null) {
            throw new SelectorSyntaxException("A call cannot carry a value constraint", source, element.offset());
        }
        if (element.focus || element.rename != null) {
            children.add(new MetaVariable(MetaKind.VALUE, element.focus, element.rename, null));
        }
        NamePattern name = NamePattern.of(element.name);
        if (name.kind() == NamePattern.Kind.ANY) {
            return new WildcardCall(element.tags, children, nesting, collapse);
        }
        return new NamedCall(name, element.tags, children, nesting, collapse);
    }

    private SelectorNode variable(Surface.Element element, boolean focus) {
        if (element.kind == Surface.ElementKind.PATH) {
            throw new SelectorSyntaxException("An absolute path must name a function", source, element.offset());
        }
        if (element.kind == Surface.ElementKind.META) {
            MetaKind kind = MetaKind.fromName(element.name)
                .orElseThrow(() -> new SelectorSyntaxException("Unknown meta variable '#" + element.name + "'", source, element.offset()));
            if (element.tags != null) {
                throw new SelectorSyntaxException("Meta variables cannot carry tags", source, element.offset());
            }
            if (kind == MetaKind.KEY) {
                if (focus) {
                    throw new SelectorSyntaxException("#key cannot be the focus", source, element.offset());
                }
                if (element.expected == null && element.rename == null) {
                    throw new SelectorSyntaxException("#key needs a value or a capture name", source, element.offset());
                }
                return new Indexed(element.expected, element.rename);
            }
            return new MetaVariable(kind, focus, element.rename, element.expected);
        }
        return new Variable(NamePattern.of(element.name), element.tags, focus, element.rename, element.expected);
    }

    private Surface.Element requireCallHead(Surface.Node node) {
        if (node instanceof Surface.Element element) {
            return element;
        }
        throw new SelectorSyntaxException("The left side of '>' must be a call", source, node.offset());
    }

    private static String describe(Surface.Element element) {
        if (element.dollar) {
            return "$" + element.rename;
        }
        return element.kind == Surface.ElementKind.META ? "#" + element.name : element.name;
    }

    private static int countFocusMarks(Surface.Node node) {
        if (node instanceof Surface.Nest nest) {
            return countFocusMarks(nest.parent()) + countFocusMarks(nest.child());
        }
        Surface.Element element = (Surface.Element) node;
        int count = element.focus ? 1 : 0;
        if (element.group != null) {
            for (Surface.Entry entry : element.group) {
                count += countFocusMarks(entry.node());
            }
        }
        return count;
    }

    private static boolean containsFocus(SelectorNode node) {
        if (node.focus()) {
            return true;
        }
        if (node instanceof CallNode call) {
            for (SelectorNode child : call.children()) {
                if (containsFocus(child)) {
                    return true;
                }
            }
        }
        return false;
    }
}
