package work.lcod.probe.selector;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses selector text into canonical {@link Selector} trees.
 *
 * <p>Several selectors may share one text when separated by {@code ;}. Shorthand forms
 * ({@code a > b}, {@code a >> b}, {@code $x}, {@code f[k]}, {@code f{..} as r}, a bare variable)
 * are expanded by {@link SelectorNormalizer} so equivalent spellings produce equal trees.</p>
 */
public final class SelectorParser {
    private SelectorParser() {}

    /**
     * Parses text holding exactly one selector.
     */
    public static Selector parse(String text) {
        List<Selector> selectors = parseAll(text);
        if (selectors.size() != 1) {
            throw new SelectorSyntaxException("Expected exactly one selector but found " + selectors.size(), text, 0);
        }
        return selectors.get(0);
    }

    /**
     * Parses every {@code ;}-separated selector in the text, in order.
     */
    public static List<Selector> parseAll(String text) {
        if (text == null) {
            throw new SelectorSyntaxException("Selector text is missing", "", 0);
        }
        Reader reader = new Reader(text, new SelectorLexer(text).tokenize());
        List<Selector> selectors = new ArrayList<>();
        for (Reader.Parsed parsed : reader.parseAll()) {
            String source = text.substring(parsed.start(), parsed.end()).trim();
            selectors.add(SelectorNormalizer.normalize(parsed.node(), source));
        }
        return List.copyOf(selectors);
    }

    private static final class Reader {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Reader(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        record Parsed(Surface.Node node, int start, int end) {}

        List<Parsed> parseAll() {
            List<Parsed> out = new ArrayList<>();
            while (true) {
                while (match(TokenType.SEMICOLON)) {
                    // empty selector between separators
                }
                if (check(TokenType.EOF)) {
                    return out;
                }
                int start = peek().offset();
                Surface.Node node = parseChain();
                out.add(new Parsed(node, start, previous().end()));
                if (!check(TokenType.EOF)) {
                    expect(TokenType.SEMICOLON, "';' between selectors");
                }
            }
        }

        private Surface.Node parseChain() {
            Surface.Node left = parseUnit();
            int offset = peek().offset();
            if (match(TokenType.GT)) {
                return new Surface.Nest(left, parseChain(), false, offset);
            }
            if (match(TokenType.DEEP_GT)) {
                return new Surface.Nest(left, parseChain(), true, offset);
            }
            return left;
        }

        private Surface.Node parseUnit() {
            Token first = peek();
            boolean focus = match(TokenType.BANG);
            if (check(TokenType.LPAREN)) {
                if (focus) {
                    throw error("Focus mark cannot precede a parenthesized selector", first);
                }
                advance();
                Surface.Node inner = parseChain();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            Surface.Element element = parseHead();
            element.focus = focus;
            parsePostfix(element);
            return element;
        }

        private Surface.Element parseHead() {
            Token token = advance();
            switch (token.type()) {
                case WORD:
                    return new Surface.Element(Surface.ElementKind.NAME, token.text(), token.offset());
                case PATH:
                    return new Surface.Element(Surface.ElementKind.PATH, token.text(), token.offset());
                case META:
                    return new Surface.Element(Surface.ElementKind.META, token.text(), token.offset());
                case DOLLAR: {
                    Token name = expect(TokenType.WORD, "capture name after '$'");
                    Surface.Element element = new Surface.Element(Surface.ElementKind.NAME, "*", token.offset());
                    element.rename = captureName(name);
                    element.dollar = true;
                    return element;
                }
                case COLON:
                    index--;
                    return new Surface.Element(Surface.ElementKind.NAME, "*", token.offset());
                default:
                    throw error("Expected a selector element", token);
            }
        }

        private void parsePostfix(Surface.Element element) {
            while (true) {
                Token token = peek();
                if (match(TokenType.LBRACKET)) {
                    if (element.key != null) {
                        throw error("Duplicate key", token);
                    }
                    element.key = parseKey();
                    expect(TokenType.RBRACKET, "']'");
                } else if (check(TokenType.LBRACE)
                        || (check(TokenType.LPAREN) && element.kind != Surface.ElementKind.META && !element.dollar)) {
                    TokenType close = advance().type() == TokenType.LBRACE ? TokenType.RBRACE : TokenType.RPAREN;
                    if (element.group != null) {
                        throw error("Duplicate argument group", token);
                    }
                    element.group = parseEntries(close);
                } else if (match(TokenType.COLON)) {
                    if (element.tags != null) {
                        throw error("Duplicate tag filter", token);
                    }
                    element.tags = parseTags();
                } else if (match(TokenType.EQUALS)) {
                    if (element.expected != null) {
                        throw error("Duplicate value constraint", token);
                    }
                    element.expected = parseLiteral();
                } else if (match(TokenType.AS)) {
                    if (element.rename != null) {
                        throw error("Duplicate capture name", token);
                    }
                    element.rename = captureName(expect(TokenType.WORD, "capture name after 'as'"));
                } else {
                    return;
                }
            }
        }

        private Surface.Key parseKey() {
            if (match(TokenType.DOLLAR)) {
                return new Surface.Key(null, captureName(expect(TokenType.WORD, "capture name after '$'")));
            }
            if (check(TokenType.WORD) && "*".equals(peek().text()) && peekAhead(1).type() == TokenType.AS) {
                advance();
                advance();
                return new Surface.Key(null, captureName(expect(TokenType.WORD, "capture name after 'as'")));
            }
            return new Surface.Key(parseLiteral(), null);
        }

        private List<Surface.Entry> parseEntries(TokenType close) {
            List<Surface.Entry> entries = new ArrayList<>();
            while (!match(close)) {
                boolean deep = match(TokenType.DEEP_GT);
                entries.add(new Surface.Entry(parseChain(), deep));
                if (!match(TokenType.COMMA)) {
                    expect(close, close == TokenType.RBRACE ? "'}'" : "')'");
                    break;
                }
            }
            return entries;
        }

        private TagFilter parseTags() {
            Set<String> tags = new LinkedHashSet<>();
            tags.add(tagName());
            TokenType combinator = null;
            while (check(TokenType.AMP) || check(TokenType.PIPE)) {
                Token op = advance();
                if (combinator != null && combinator != op.type()) {
                    throw error("Cannot mix '&' and '|' in one tag filter", op);
                }
                combinator = op.type();
                tags.add(tagName());
            }
            return combinator == TokenType.PIPE ? TagFilter.anyOf(tags) : TagFilter.allOf(tags);
        }

        private String tagName() {
            match(TokenType.AT);
            return expect(TokenType.WORD, "tag name").text();
        }

        private Literal parseLiteral() {
            Token token = advance();
            if (token.type() == TokenType.STRING) {
                return new Literal(token.text());
            }
            if (token.type() == TokenType.WORD) {
                return Literal.fromWord(token.text());
            }
            throw error("Expected a literal value", token);
        }

        private String captureName(Token token) {
            String name = token.text();
            if (name.indexOf('*') >= 0) {
                throw error("Capture name cannot contain '*'", token);
            }
            return name;
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token peekAhead(int distance) {
            return tokens.get(Math.min(index + distance, tokens.size() - 1));
        }

        private Token previous() {
            return tokens.get(Math.max(index - 1, 0));
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        private boolean check(TokenType type) {
            return peek().type() == type;
        }

        private boolean match(TokenType type) {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String what) {
            if (!check(type)) {
                Token found = peek();
                throw error("Expected " + what + " but found "
                    + (found.type() == TokenType.EOF ? "end of input" : "'" + found.text() + "'"), found);
            }
            return advance();
        }

        private SelectorSyntaxException error(String message, Token at) {
            return new SelectorSyntaxException(message, source, at.offset());
        }
    }
}
