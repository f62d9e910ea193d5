package work.lcod.notegen.formula;

/**
 * Splits a formula into tokens. Dotted references ({@code a.b[0].c}) are read as one PATH token.
 */
final class FormulaLexer {
    private final String source;
    private int pos;

    FormulaLexer(String source) {
        this.source = source;
    }

    Token next() {
        skipWhitespace();
        if (pos >= source.length()) {
            return new Token(TokenType.EOF, null, pos);
        }
        int start = pos;
        char c = source.charAt(pos);
        if (isIdentStart(c)) {
            return readPath(start);
        }
        if (Character.isDigit(c)) {
            return readNumber(start);
        }
        if (c == '\'' || c == '"') {
            return readString(start, c);
        }
        if (pos + 1 < source.length()) {
            var two = source.substring(pos, pos + 2);
            switch (two) {
                case "&&":
                    pos += 2;
                    return new Token(TokenType.ANDAND, two, start);
                case "||":
                    pos += 2;
                    return new Token(TokenType.OROR, two, start);
                case "==":
                    pos += 2;
                    return new Token(TokenType.EQ, two, start);
                case "!=":
                    pos += 2;
                    return new Token(TokenType.NE, two, start);
                case "<=":
                    pos += 2;
                    return new Token(TokenType.LE, two, start);
                case ">=":
                    pos += 2;
                    return new Token(TokenType.GE, two, start);
                default:
                    break;
            }
        }
        pos++;
        switch (c) {
            case '+':
                return new Token(TokenType.PLUS, "+", start);
            case '-':
                return new Token(TokenType.MINUS, "-", start);
            case '*':
                return new Token(TokenType.STAR, "*", start);
            case '/':
                return new Token(TokenType.SLASH, "/", start);
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case '?':
                return new Token(TokenType.QUESTION, "?", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '!':
                return new Token(TokenType.NOT, "!", start);
            case '<':
                return new Token(TokenType.LT, "<", start);
            case '>':
                return new Token(TokenType.GT, ">", start);
            default:
                throw new FormulaException("unexpected character '" + c + "' at position " + start);
        }
    }

    private Token readPath(int start) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isIdentPart(c)) {
                pos++;
            } else if (c == '.' && pos + 1 < source.length() && isIdentStart(source.charAt(pos + 1))) {
                pos++;
            } else if (c == '[') {
                int close = source.indexOf(']', pos);
                if (close < 0) {
                    throw new FormulaException("unterminated index at position " + pos);
                }
                var digits = source.substring(pos + 1, close);
                if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                    throw new FormulaException("invalid index '" + digits + "' at position " + pos);
                }
                pos = close + 1;
            } else {
                break;
            }
        }
        var text = source.substring(start, pos);
        switch (text) {
            case "true":
                return new Token(TokenType.TRUE, text, start);
            case "false":
                return new Token(TokenType.FALSE, text, start);
            case "null":
                return new Token(TokenType.NULL, text, start);
            default:
                return new Token(TokenType.PATH, text, start);
        }
    }

    private Token readNumber(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            int fraction = pos + 1;
            if (fraction >= source.length() || !Character.isDigit(source.charAt(fraction))) {
                throw new FormulaException("malformed number at position " + start);
            }
            pos = fraction;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && isIdentStart(source.charAt(pos))) {
            throw new FormulaException("malformed number at position " + start);
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token readString(int start, char quote) {
        pos++;
        var builder = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, builder.toString(), start);
            }
            if (c == '\\') {
                if (pos >= source.length()) {
                    break;
                }
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        builder.append('\n');
                        break;
                    case 't':
                        builder.append('\t');
                        break;
                    default:
                        builder.append(escaped);
                }
            } else {
                builder.append(c);
            }
        }
        throw new FormulaException("unterminated string starting at position " + start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }
}
