package work.lcod.probe.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits selector text into tokens. A {@code #} followed by whitespace or the end of input starts a
 * comment running to the end of the line; {@code #name} is a meta variable.
 */
final class SelectorLexer {
    private final String source;
    private int pos;

    SelectorLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipBlankAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            Token token = next();
            tokens.add(new Token(token.type(), token.text(), token.offset(), pos));
        }
    }

    private void skipBlankAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' && (pos + 1 >= source.length() || Character.isWhitespace(source.charAt(pos + 1)))) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '>':
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '>') {
                    pos += 2;
                    return new Token(TokenType.DEEP_GT, ">>", start);
                }
                pos++;
                return new Token(TokenType.GT, ">", start);
            case '{':
                return single(TokenType.LBRACE);
            case '}':
                return single(TokenType.RBRACE);
            case '(':
                return single(TokenType.LPAREN);
            case ')':
                return single(TokenType.RPAREN);
            case '[':
                return single(TokenType.LBRACKET);
            case ']':
                return single(TokenType.RBRACKET);
            case ',':
                return single(TokenType.COMMA);
            case ':':
                return single(TokenType.COLON);
            case '&':
                return single(TokenType.AMP);
            case '|':
                return single(TokenType.PIPE);
            case '@':
                return single(TokenType.AT);
            case '!':
                return single(TokenType.BANG);
            case '=':
                return single(TokenType.EQUALS);
            case ';':
                return single(TokenType.SEMICOLON);
            case '$':
                return single(TokenType.DOLLAR);
            case '"':
            case '\'':
                return string(c);
            case '#':
                pos++;
                String meta = readWhile(SelectorLexer::isWordChar);
                if (meta.isEmpty()) {
                    throw new SelectorSyntaxException("Expected a meta variable name after '#'", source, start);
                }
                return new Token(TokenType.META, meta, start);
            case '/':
                String path = readWhile(ch -> isWordChar(ch) || ch == '/');
                return new Token(TokenType.PATH, path, start);
            default:
                break;
        }
        if (c == '-' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            return new Token(TokenType.WORD, "-" + readWhile(SelectorLexer::isWordChar), start);
        }
        if (isWordChar(c)) {
            String word = readWhile(SelectorLexer::isWordChar);
            return new Token("as".equals(word) ? TokenType.AS : TokenType.WORD, word, start);
        }
        throw new SelectorSyntaxException("Unexpected character '" + c + "'", source, start);
    }

    private Token single(TokenType type) {
        Token token = new Token(type, String.valueOf(source.charAt(pos)), pos);
        pos++;
        return token;
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, value.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                c = source.charAt(pos++);
            }
            value.append(c);
        }
        throw new SelectorSyntaxException("Unterminated string literal", source, start);
    }

    private String readWhile(CharPredicate predicate) {
        int start = pos;
        while (pos < source.length() && predicate.test(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '*' || c == '.';
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
