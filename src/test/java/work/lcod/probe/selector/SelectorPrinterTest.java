package work.lcod.probe.selector;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class SelectorPrinterTest {
    @Test
    void printedSelectorsParseBackToTheSameTree() {
        var texts = List.of(
            "a",
            "a > b > c",
            "a >> b",
            "fact(i, !curr)",
            "main(x, side(x as x2), negmul(!a))",
            "f{$x}",
            "f[k] > y",
            "f[$i]{y} as r",
            "!f{x=-2, y=\"two words\"}",
            "/zoo.animals/Elephant/sing:loud&big{!y:Fruit|Veg}",
            "f{>> g{z}, #error as e}",
            "gen > #yield",
            "train_*{loss=0.5}"
        );
        for (String text : texts) {
            var selector = SelectorParser.parse(text);
            var printed = SelectorPrinter.print(selector);
            assertEquals(selector.root(), SelectorParser.parse(printed).root(), text + " printed as " + printed);
        }
    }

    @Test
    void printsCanonicalForm() {
        assertEquals("*{!a}", SelectorParser.parse("a").canonicalText());
        assertEquals("f{>> !b}", SelectorParser.parse("f >> b").canonicalText());
        assertEquals("f{#key=3, y, #value as r}", SelectorParser.parse("f[3]{y} as r").canonicalText());
    }
}
