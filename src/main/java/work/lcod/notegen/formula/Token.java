package work.lcod.notegen.formula;

record Token(TokenType type, String text, int position) {
    @Override
    public String toString() {
        return text == null ? type.name() : type.name() + "('" + text + "')";
    }
}
