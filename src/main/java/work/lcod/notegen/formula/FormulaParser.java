package work.lcod.notegen.formula;

import work.lcod.notegen.path.InvalidPathException;

/**
 * Recursive-descent parser:
 *
 * <pre>
 * expression  := conditional
 * conditional := logicalOr ('?' expression ':' expression)?
 * logicalOr   := logicalAnd ('||' logicalAnd)*
 * logicalAnd  := comparison ('&amp;&amp;' comparison)*
 * comparison  := additive (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)?
 * additive    := term (('+' | '-') term)*
 * term        := factor (('*' | '/') factor)*
 * factor      := NUMBER | STRING | true | false | null | PATH | '(' expression ')' | '-' factor | '!' factor
 * </pre>
 */
final class FormulaParser {
    private final String formula;
    private final FormulaLexer lexer;
    private Token lookahead;

    FormulaParser(String formula) {
        this.formula = formula;
        this.lexer = new FormulaLexer(formula);
        this.lookahead = lexer.next();
    }

    Expression parse() {
        var expression = parseExpression();
        if (lookahead.type() != TokenType.EOF) {
            throw error("unexpected token " + lookahead + " at position " + lookahead.position());
        }
        return expression;
    }

    private Expression parseExpression() {
        var condition = parseOr();
        if (look(TokenType.QUESTION)) {
            eat(TokenType.QUESTION);
            var whenTrue = parseExpression();
            eat(TokenType.COLON);
            var whenFalse = parseExpression();
            return new Expression.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expression parseOr() {
        var left = parseAnd();
        while (look(TokenType.OROR)) {
            eat(TokenType.OROR);
            left = new Expression.Binary("||", left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        var left = parseComparison();
        while (look(TokenType.ANDAND)) {
            eat(TokenType.ANDAND);
            left = new Expression.Binary("&&", left, parseComparison());
        }
        return left;
    }

    private Expression parseComparison() {
        var left = parseAdditive();
        switch (lookahead.type()) {
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE: {
                var operator = eat(lookahead.type()).text();
                return new Expression.Binary(operator, left, parseAdditive());
            }
            default:
                return left;
        }
    }

    private Expression parseAdditive() {
        var left = parseTerm();
        while (look(TokenType.PLUS) || look(TokenType.MINUS)) {
            var operator = eat(lookahead.type()).text();
            left = new Expression.Binary(operator, left, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        var left = parseFactor();
        while (look(TokenType.STAR) || look(TokenType.SLASH)) {
            var operator = eat(lookahead.type()).text();
            left = new Expression.Binary(operator, left, parseFactor());
        }
        return left;
    }

    private Expression parseFactor() {
        switch (lookahead.type()) {
            case NUMBER:
                return Expression.number(eat(TokenType.NUMBER).text());
            case STRING:
                return new Expression.Literal(eat(TokenType.STRING).text());
            case TRUE:
                eat(TokenType.TRUE);
                return new Expression.Literal(Boolean.TRUE);
            case FALSE:
                eat(TokenType.FALSE);
                return new Expression.Literal(Boolean.FALSE);
            case NULL:
                eat(TokenType.NULL);
                return new Expression.Literal(null);
            case PATH: {
                var token = eat(TokenType.PATH);
                try {
                    return Expression.PathRef.of(token.text());
                } catch (InvalidPathException ex) {
                    throw error("invalid reference '" + token.text() + "'");
                }
            }
            case LPAREN: {
                eat(TokenType.LPAREN);
                var inner = parseExpression();
                eat(TokenType.RPAREN);
                return inner;
            }
            case MINUS:
                eat(TokenType.MINUS);
                return new Expression.Unary("-", parseFactor());
            case NOT:
                eat(TokenType.NOT);
                return new Expression.Unary("!", parseFactor());
            default:
                throw error("unexpected token " + lookahead + " at position " + lookahead.position());
        }
    }

    private boolean look(TokenType type) {
        return lookahead.type() == type;
    }

    private Token eat(TokenType type) {
        if (lookahead.type() != type) {
            throw error("expected " + type + " but got " + lookahead + " at position " + lookahead.position());
        }
        var current = lookahead;
        lookahead = lexer.next();
        return current;
    }

    private FormulaException error(String reason) {
        return new FormulaException(formula, reason);
    }
}
