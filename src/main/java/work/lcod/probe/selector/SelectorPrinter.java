package work.lcod.probe.selector;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Renders canonical trees back to selector text.
 */
public final class SelectorPrinter {
    private SelectorPrinter() {}

    public static String print(Selector selector) {
        return print(selector.root());
    }

    public static String print(CallNode root) {
        StringBuilder out = new StringBuilder();
        appendCall(out, root);
        return out.toString();
    }

    private static void appendNode(StringBuilder out, SelectorNode node) {
        if (node instanceof CallNode call) {
            if (call.nesting() == Nesting.DEEP) {
                out.append(">> ");
            }
            if (call.collapse() && call.children().size() == 1 && !(call.children().get(0) instanceof CallNode)) {
                appendNode(out, call.children().get(0));
            } else {
                appendCall(out, call);
            }
        } else if (node instanceof Variable variable) {
            if (variable.focus()) {
                out.append('!');
            }
            out.append(variable.pattern().text());
            appendTags(out, variable.tagFilter());
            appendExpected(out, variable.expected());
            appendRename(out, variable.rename());
        } else if (node instanceof MetaVariable meta) {
            if (meta.focus()) {
                out.append('!');
            }
            out.append('#').append(meta.kind().name().toLowerCase(Locale.ROOT));
            appendExpected(out, meta.expected());
            appendRename(out, meta.rename());
        } else if (node instanceof Indexed indexed) {
            out.append("#key");
            appendExpected(out, indexed.key());
            appendRename(out, indexed.rename());
        }
    }

    private static void appendCall(StringBuilder out, CallNode call) {
        out.append(call.name().text());
        appendTags(out, call.tags());
        StringJoiner children = new StringJoiner(", ", "{", "}");
        for (SelectorNode child : call.children()) {
            StringBuilder part = new StringBuilder();
            appendNode(part, child);
            children.add(part);
        }
        out.append(children);
    }

    private static void appendTags(StringBuilder out, TagFilter tags) {
        if (tags.isEmpty()) {
            return;
        }
        String separator = tags.combinator() == TagFilter.Combinator.ALL ? "&" : "|";
        out.append(':').append(String.join(separator, tags.tags().stream().sorted().toList()));
    }

    private static void appendExpected(StringBuilder out, Literal expected) {
        if (expected != null) {
            out.append('=').append(expected.render());
        }
    }

    private static void appendRename(StringBuilder out, String rename) {
        if (rename != null) {
            out.append(" as ").append(rename);
        }
    }
}
