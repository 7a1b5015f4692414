package work.lcod.probe.selector;

record Token(TokenType type, String text, int offset, int end) {
    Token(TokenType type, String text, int offset) {
        this(type, text, offset, offset);
    }
}
