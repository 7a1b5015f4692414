package work.lcod.probe.selector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SelectorParserTest {
    private static CallNode root(String text) {
        return SelectorParser.parse(text).root();
    }

    @Test
    void shorthandFormsNormalizeToTheSameTree() {
        assertEquals(root("*{!a}"), root("a"));
        assertEquals(root("a{!b}"), root("a > b"));
        assertEquals(root("a{b{!c}}"), root("a > b > c"));
        assertEquals(root("a{>> !b}"), root("a >> b"));
        assertEquals(root("f{* as x}"), root("f{$x}"));
        assertEquals(root("a{#key=k}"), root("a[k]"));
        assertEquals(root("a{x, y, #value as b}"), root("a{x, y} as b"));
        assertEquals(root("a{x, !#value}"), root("!a{x}"));
        assertEquals(root("fact{i, !curr}"), root("fact(i, !curr)"));
        assertEquals(root("a{#key as i}"), root("a[$i]"));
    }

    @Test
    void bareVariableBecomesFocusedWildcard() {
        var selector = SelectorParser.parse("a");
        var root = assertInstanceOf(WildcardCall.class, selector.root());
        var variable = assertInstanceOf(Variable.class, root.children().get(0));
        assertEquals("a", variable.pattern().text());
        assertTrue(variable.focus());
        assertEquals(ProbeKind.IMMEDIATE, selector.kind());
    }

    @Test
    void deepVariableIsWrappedInCollapsingWildcard() {
        var root = assertInstanceOf(NamedCall.class, root("a >> b"));
        var wrapper = assertInstanceOf(WildcardCall.class, root.children().get(0));
        assertEquals(Nesting.DEEP, wrapper.nesting());
        assertTrue(wrapper.collapse());
        assertTrue(wrapper.children().get(0).focus());
    }

    @Test
    void deepSubCallDoesNotCollapse() {
        var root = assertInstanceOf(NamedCall.class, root("f{>> h{!y}}"));
        var sub = assertInstanceOf(NamedCall.class, root.children().get(0));
        assertEquals(Nesting.DEEP, sub.nesting());
        assertFalse(sub.collapse());
    }

    @Test
    void chainTerminalIsImplicitFocusOnlyWithoutExplicitMark() {
        var implicit = assertInstanceOf(NamedCall.class, root("f > x"));
        assertTrue(implicit.children().get(0).focus());

        var explicit = SelectorParser.parse("f{!y} > x");
        var call = assertInstanceOf(NamedCall.class, explicit.root());
        assertTrue(call.children().get(0).focus());
        assertFalse(call.children().get(1).focus());
    }

    @Test
    void selectorWithoutFocusIsTotal() {
        assertEquals(ProbeKind.TOTAL, SelectorParser.parse("f{x, y}").kind());
        assertEquals(ProbeKind.TOTAL, SelectorParser.parse("f > g{x}").kind());
        assertEquals(ProbeKind.IMMEDIATE, SelectorParser.parse("f{x, !y}").kind());
    }

    @Test
    void moreThanOneFocusIsRejected() {
        var ex = assertThrows(MultipleFocusException.class, () -> SelectorParser.parse("f(!x, !y)"));
        assertEquals(2, ex.focusCount());
        assertEquals("multiple_focus", ex.code());
    }

    @Test
    void syntaxErrorsReportOffset() {
        var ex = assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("f{x, y"));
        assertEquals("selector_syntax", ex.code());
        assertEquals(6, ex.offset());

        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("f{x} {y}"));
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("f:a&b|c"));
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("#nope"));
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("f{x} ~"));
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("(a > b) > c"));
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("$x{y}"));
    }

    @Test
    void parsesSeveralSelectorsAndSkipsComments() {
        var selectors = SelectorParser.parseAll("""
            # probes for the factorial
            fact > curr;
            fact{i, n};   # the loop counters
            """);
        assertEquals(2, selectors.size());
        assertEquals("fact > curr", selectors.get(0).text());
        assertEquals("fact{i, n}", selectors.get(1).text());
        assertThrows(SelectorSyntaxException.class, () -> SelectorParser.parse("a; b"));
    }

    @Test
    void readsTagsValuesAndPaths() {
        var root = assertInstanceOf(NamedCall.class, root("/zoo.animals/Elephant/sing:@loud{x=1, !y:Fruit|Veg}"));
        assertEquals(NamePattern.Kind.ABSOLUTE, root.name().kind());
        assertEquals(Set.of("loud"), root.tags().tags());

        var constrained = assertInstanceOf(Variable.class, root.children().get(0));
        assertEquals(new Literal(1L), constrained.expected());
        assertTrue(constrained.expected().matches(1));

        var tagged = assertInstanceOf(Variable.class, root.children().get(1));
        assertEquals(TagFilter.Combinator.ANY, tagged.tagFilter().combinator());
        assertTrue(tagged.tagFilter().test(Set.of("Veg")));
        assertFalse(tagged.tagFilter().test(Set.of("Meat")));
    }

    @Test
    void readsGlobsAndQuotedLiterals() {
        var root = assertInstanceOf(NamedCall.class, root("train_*{!loss, mode=\"eval mode\"}"));
        assertEquals(NamePattern.Kind.GLOB, root.name().kind());
        assertTrue(root.name().matches("train_epoch"));
        assertFalse(root.name().matches("test_epoch"));
        var mode = assertInstanceOf(Variable.class, root.children().get(1));
        assertEquals("eval mode", mode.expected().value());
    }

    @Test
    void indexedKeyCarriesLiteralOrCapture() {
        var literal = assertInstanceOf(NamedCall.class, root("step[3] > loss"));
        var key = assertInstanceOf(Indexed.class, literal.children().get(0));
        assertEquals(new Literal(3L), key.key());
        assertNull(key.rename());

        var capture = assertInstanceOf(NamedCall.class, root("step[$k] > loss"));
        var captured = assertInstanceOf(Indexed.class, capture.children().get(0));
        assertNull(captured.key());
        assertEquals("k", captured.rename());
    }

    @Test
    void metaVariablesParse() {
        var root = assertInstanceOf(NamedCall.class, root("gen{!#yield as item, #receive}"));
        var yielded = assertInstanceOf(MetaVariable.class, root.children().get(0));
        assertEquals(MetaKind.YIELD, yielded.kind());
        assertEquals("item", yielded.rename());
        assertEquals(List.of(MetaKind.YIELD, MetaKind.RECEIVE),
            root.children().stream().map(node -> ((MetaVariable) node).kind()).toList());
    }
}
