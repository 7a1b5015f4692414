package work.lcod.probe.selector;

import java.util.List;

/**
 * Selector tree as written, before shorthand is expanded.
 */
final class Surface {
    private Surface() {}

    interface Node {
        int offset();
    }

    enum ElementKind {
        NAME,
        PATH,
        META
    }

    static final class Element implements Node {
        final ElementKind kind;
        final String name;
        final int offset;
        boolean focus;
        Key key;
        List<Entry> group;
        TagFilter tags;
        Literal expected;
        String rename;
        boolean dollar;

        Element(ElementKind kind, String name, int offset) {
            this.kind = kind;
            this.name = name;
            this.offset = offset;
        }

        @Override
        public int offset() {
            return offset;
        }

        boolean callLike() {
            return kind == ElementKind.PATH || group != null || key != null;
        }
    }

    record Nest(Node parent, Node child, boolean deep, int offset) implements Node {}

    record Entry(Node node, boolean deep) {}

    record Key(Literal literal, String capture) {}
}
