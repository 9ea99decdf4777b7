package work.agentflow.engine.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.agentflow.engine.condition.ExpressionNode.Binary;
import work.agentflow.engine.condition.ExpressionNode.ListLiteral;
import work.agentflow.engine.condition.ExpressionNode.Literal;
import work.agentflow.engine.condition.ExpressionNode.Operator;
import work.agentflow.engine.condition.ExpressionNode.Unary;
import work.agentflow.engine.condition.ExpressionNode.Variable;

/**
 * Recursive-descent parser for the restricted expression language:
 * literals, {@code ${...}} references, list literals, arithmetic, comparison, boolean and membership
 * operators. Calls, attribute access, subscripts, imports and bare names are rejected.
 */
public final class ExpressionParser {
    public static final int MAX_DEPTH = 50;
    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of("import", "from", "lambda", "exec", "eval");

    private final String source;
    private final List<Token> tokens;
    private int position;
    private int depth;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    public static ExpressionNode parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression", String.valueOf(source), -1);
        }
        var parser = new ExpressionParser(source);
        var node = parser.parseOr();
        var trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw parser.error("Unexpected '" + trailing.text() + "'", trailing);
        }
        return node;
    }

    private ExpressionNode parseOr() {
        enter();
        try {
            var left = parseAnd();
            while (matchKeyword("or") || matchSymbol("||")) {
                left = new Binary(Operator.OR, left, parseAnd());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private ExpressionNode parseAnd() {
        var left = parseNot();
        while (matchKeyword("and") || matchSymbol("&&")) {
            left = new Binary(Operator.AND, left, parseNot());
        }
        return left;
    }

    private ExpressionNode parseNot() {
        if (matchKeyword("not") || matchSymbol("!")) {
            enter();
            try {
                return new Unary(Operator.NOT, parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        var left = parseAdditive();
        var operator = comparisonOperator();
        if (operator == null) {
            return left;
        }
        var node = new Binary(operator, left, parseAdditive());
        var chained = peek();
        if (comparisonOperator() != null) {
            throw error("Chained comparisons are not supported", chained);
        }
        return node;
    }

    private Operator comparisonOperator() {
        var token = peek();
        if (token.type() == TokenType.SYMBOL) {
            var operator = switch (token.text()) {
                case "==" -> Operator.EQ;
                case "!=" -> Operator.NE;
                case "<" -> Operator.LT;
                case "<=" -> Operator.LE;
                case ">" -> Operator.GT;
                case ">=" -> Operator.GE;
                default -> null;
            };
            if (operator != null) {
                position++;
            }
            return operator;
        }
        if (matchKeyword("in")) {
            return Operator.IN;
        }
        if (isKeyword(peek(), "not") && isKeyword(peekAhead(1), "in")) {
            position += 2;
            return Operator.NOT_IN;
        }
        return null;
    }

    private ExpressionNode parseAdditive() {
        var left = parseMultiplicative();
        while (true) {
            if (matchSymbol("+")) {
                left = new Binary(Operator.ADD, left, parseMultiplicative());
            } else if (matchSymbol("-")) {
                left = new Binary(Operator.SUBTRACT, left, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseMultiplicative() {
        var left = parseUnary();
        while (true) {
            if (matchSymbol("*")) {
                left = new Binary(Operator.MULTIPLY, left, parseUnary());
            } else if (matchSymbol("/")) {
                left = new Binary(Operator.DIVIDE, left, parseUnary());
            } else if (matchSymbol("%")) {
                left = new Binary(Operator.MODULO, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseUnary() {
        Operator operator = null;
        if (matchSymbol("-")) {
            operator = Operator.NEGATE;
        } else if (matchSymbol("+")) {
            operator = Operator.PLUS;
        }
        if (operator == null) {
            return parsePostfix();
        }
        enter();
        try {
            return new Unary(operator, parseUnary());
        } finally {
            depth--;
        }
    }

    private ExpressionNode parsePostfix() {
        var node = parsePrimary();
        var next = peek();
        if (next.type() == TokenType.SYMBOL) {
            switch (next.text()) {
                case "(" -> throw error("Function calls are not allowed", next);
                case "." -> throw error("Attribute access is not allowed", next);
                case "[" -> throw error("Subscripts are not allowed", next);
                default -> {
                }
            }
        }
        return node;
    }

    private ExpressionNode parsePrimary() {
        var token = next();
        switch (token.type()) {
            case NUMBER:
                return new Literal(new BigDecimal(token.text()));
            case STRING:
                return new Literal(token.text());
            case VARIABLE:
                return new Variable(token.text());
            case IDENTIFIER:
                return identifier(token);
            case SYMBOL:
                if ("(".equals(token.text())) {
                    var inner = parseOr();
                    expectSymbol(")");
                    return inner;
                }
                if ("[".equals(token.text())) {
                    return listLiteral();
                }
                throw error("Unexpected '" + token.text() + "'", token);
            default:
                throw error("Unexpected end of expression", token);
        }
    }

    private ExpressionNode identifier(Token token) {
        switch (token.text()) {
            case "true", "True":
                return new Literal(Boolean.TRUE);
            case "false", "False":
                return new Literal(Boolean.FALSE);
            case "null", "None":
                return new Literal(null);
            default:
                break;
        }
        if (FORBIDDEN_KEYWORDS.contains(token.text())) {
            throw error("'" + token.text() + "' is not allowed", token);
        }
        var next = peek();
        if (next.type() == TokenType.SYMBOL && "(".equals(next.text())) {
            throw error("Function calls are not allowed: " + token.text(), token);
        }
        if (next.type() == TokenType.SYMBOL && ".".equals(next.text())) {
            throw error("Attribute access is not allowed: " + token.text(), token);
        }
        throw error("Unknown name '" + token.text() + "' (reference variables as ${namespace.path})", token);
    }

    private ExpressionNode listLiteral() {
        enter();
        try {
            var elements = new ArrayList<ExpressionNode>();
            if (matchSymbol("]")) {
                return new ListLiteral(elements);
            }
            do {
                elements.add(parseOr());
            } while (matchSymbol(","));
            expectSymbol("]");
            return new ListLiteral(elements);
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionException("Expression nesting exceeds " + MAX_DEPTH + " levels", source, peek().offset());
        }
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token next() {
        var token = tokens.get(position);
        if (token.type() != TokenType.END) {
            position++;
        }
        return token;
    }

    private boolean matchSymbol(String symbol) {
        var token = peek();
        if (token.type() == TokenType.SYMBOL && token.text().equals(symbol)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (isKeyword(peek(), keyword)) {
            position++;
            return true;
        }
        return false;
    }

    private static boolean isKeyword(Token token, String keyword) {
        return token.type() == TokenType.IDENTIFIER && token.text().equals(keyword);
    }

    private void expectSymbol(String symbol) {
        var token = peek();
        if (!matchSymbol(symbol)) {
            throw error("Expected '" + symbol + "'", token);
        }
    }

    private ExpressionException error(String message, Token token) {
        return new ExpressionException(message, source, token.offset());
    }

    enum TokenType {
        NUMBER,
        STRING,
        VARIABLE,
        IDENTIFIER,
        SYMBOL,
        END
    }

    record Token(TokenType type, String text, int offset) {}

    private static final class Lexer {
        private static final List<String> SYMBOLS = List.of(
            "==", "!=", "<=", ">=", "&&", "||", "<", ">", "+", "-", "*", "/", "%", "(", ")", "[", "]", ",", ".", "!"
        );

        private final String source;
        private int index;

        Lexer(String source) {
            this.source = source;
        }

        List<Token> tokenize() {
            var tokens = new ArrayList<Token>();
            while (true) {
                skipWhitespace();
                if (index >= source.length()) {
                    tokens.add(new Token(TokenType.END, "<end>", index));
                    return tokens;
                }
                tokens.add(nextToken());
            }
        }

        private Token nextToken() {
            var start = index;
            var ch = source.charAt(index);
            if (Character.isDigit(ch)) {
                return number(start);
            }
            if (ch == '\'' || ch == '"') {
                return string(start, ch);
            }
            if (ch == '$' && index + 1 < source.length() && source.charAt(index + 1) == '{') {
                var close = source.indexOf('}', index + 2);
                if (close < 0) {
                    throw new ExpressionException("Unterminated variable reference", source, start);
                }
                index = close + 1;
                return new Token(TokenType.VARIABLE, source.substring(start + 2, close).trim(), start);
            }
            if (Character.isLetter(ch) || ch == '_') {
                while (index < source.length() && (Character.isLetterOrDigit(source.charAt(index)) || source.charAt(index) == '_')) {
                    index++;
                }
                return new Token(TokenType.IDENTIFIER, source.substring(start, index), start);
            }
            for (var symbol : SYMBOLS) {
                if (source.startsWith(symbol, index)) {
                    index += symbol.length();
                    return new Token(TokenType.SYMBOL, symbol, start);
                }
            }
            throw new ExpressionException("Unexpected character '" + ch + "'", source, start);
        }

        private Token number(int start) {
            while (index < source.length() && Character.isDigit(source.charAt(index))) {
                index++;
            }
            if (index + 1 < source.length() && source.charAt(index) == '.' && Character.isDigit(source.charAt(index + 1))) {
                index++;
                while (index < source.length() && Character.isDigit(source.charAt(index))) {
                    index++;
                }
            }
            return new Token(TokenType.NUMBER, source.substring(start, index), start);
        }

        private Token string(int start, char quote) {
            var value = new StringBuilder();
            index++;
            while (index < source.length()) {
                var ch = source.charAt(index++);
                if (ch == quote) {
                    return new Token(TokenType.STRING, value.toString(), start);
                }
                if (ch == '\\' && index < source.length()) {
                    var escaped = source.charAt(index++);
                    value.append(switch (escaped) {
                        case 'n' -> '\n';
                        case 't' -> '\t';
                        default -> escaped;
                    });
                } else {
                    value.append(ch);
                }
            }
            throw new ExpressionException("Unterminated string literal", source, start);
        }

        private void skipWhitespace() {
            while (index < source.length() && Character.isWhitespace(source.charAt(index))) {
                index++;
            }
        }
    }
}
