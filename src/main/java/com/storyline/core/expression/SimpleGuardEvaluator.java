package com.storyline.core.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Small boolean guard language for hosts without their own expression engine.
 * <p>
 * Supports:
 * <ul>
 *   <li>Literals: integers and decimals with an optional leading {@code -}, {@code 'single'} or {@code "double"} quoted strings, {@code true}, {@code false}</li>
 *   <li>Variables: identifiers ({@code [A-Za-z_][A-Za-z0-9_.]*}) looked up in the {@link VariableContext}</li>
 *   <li>Comparisons: {@code == = != > >= < <=}</li>
 *   <li>Logic: {@code && || !} and the words {@code and or not}</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * Precedence: {@code !} &gt; comparison &gt; {@code &&} &gt; {@code ||}. Logic operators short-circuit.
 * Each call parses the guard afresh; nothing is cached between calls.
 */
public class SimpleGuardEvaluator implements ExpressionEvaluator {

    private static final Set<String> COMPARISONS = Set.of("==", "=", "!=", ">", ">=", "<", "<=");

    private enum TokenType { NUMBER, STRING, IDENT, OPERATOR, EOF }

    private record Token(TokenType type, String text, int position) {}

    @Override
    public boolean evaluate(String guardSource, VariableContext context) {
        if (guardSource == null || guardSource.isBlank()) {
            throw new EvaluationException("Empty guard expression");
        }
        var parser = new Parser(guardSource, tokenize(guardSource));
        Function<VariableContext, Object> expression = parser.parse();
        return asBoolean(expression.apply(context), guardSource.strip());
    }

    // -- tokenizer -------------------------------------------------------

    private static List<Token> tokenize(String source) {
        var tokens = new ArrayList<Token>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
            } else if (c == '"' || c == '\'') {
                int start = i++;
                var sb = new StringBuilder();
                while (i < source.length() && source.charAt(i) != c) {
                    sb.append(source.charAt(i++));
                }
                if (i >= source.length()) {
                    throw new EvaluationException("Unterminated string literal at position " + start);
                }
                i++;
                tokens.add(new Token(TokenType.STRING, sb.toString(), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length()
                        && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_' || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENT, source.substring(start, i), start));
            } else {
                String two = i + 1 < source.length() ? source.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals(">=") || two.equals("<=")
                        || two.equals("&&") || two.equals("||")) {
                    tokens.add(new Token(TokenType.OPERATOR, two, i));
                    i += 2;
                } else if ("=<>!()-".indexOf(c) >= 0) {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i));
                    i++;
                } else {
                    throw new EvaluationException("Unexpected character '" + c + "' at position " + i);
                }
            }
        }
        tokens.add(new Token(TokenType.EOF, "", source.length()));
        return tokens;
    }

    // -- parser ----------------------------------------------------------

    private static final class Parser {

        private final String source;
        private final List<Token> tokens;
        private int index;

        Parser(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Function<VariableContext, Object> parse() {
            var expression = parseOr();
            if (peek().type() != TokenType.EOF) {
                throw error("Unexpected '" + peek().text() + "'");
            }
            return expression;
        }

        private Function<VariableContext, Object> parseOr() {
            var left = parseAnd();
            while (matchOperator("||") || matchWord("or")) {
                var lhs = left;
                var rhs = parseAnd();
                left = ctx -> asBoolean(lhs.apply(ctx), source) || asBoolean(rhs.apply(ctx), source);
            }
            return left;
        }

        private Function<VariableContext, Object> parseAnd() {
            var left = parseUnary();
            while (matchOperator("&&") || matchWord("and")) {
                var lhs = left;
                var rhs = parseUnary();
                left = ctx -> asBoolean(lhs.apply(ctx), source) && asBoolean(rhs.apply(ctx), source);
            }
            return left;
        }

        private Function<VariableContext, Object> parseUnary() {
            if (matchOperator("!") || matchWord("not")) {
                var operand = parseUnary();
                return ctx -> !asBoolean(operand.apply(ctx), source);
            }
            return parseComparison();
        }

        private Function<VariableContext, Object> parseComparison() {
            var left = parsePrimary();
            Token next = peek();
            if (next.type() == TokenType.OPERATOR && COMPARISONS.contains(next.text())) {
                index++;
                var right = parsePrimary();
                String op = next.text();
                return ctx -> compare(left.apply(ctx), op, right.apply(ctx));
            }
            return left;
        }

        private Function<VariableContext, Object> parsePrimary() {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                throw error("Unexpected end of expression");
            }
            index++;
            switch (token.type()) {
                case NUMBER -> {
                    BigDecimal value = number(token);
                    return ctx -> value;
                }
                case STRING -> {
                    String value = token.text();
                    return ctx -> value;
                }
                case IDENT -> {
                    if (token.text().equals("true") || token.text().equals("false")) {
                        Boolean value = Boolean.valueOf(token.text());
                        return ctx -> value;
                    }
                    String name = token.text();
                    return ctx -> normalize(ctx.lookup(name)
                            .orElseThrow(() -> new EvaluationException("Unknown variable '" + name + "'")));
                }
                case OPERATOR -> {
                    if (token.text().equals("-") && peek().type() == TokenType.NUMBER) {
                        BigDecimal value = number(tokens.get(index++)).negate();
                        return ctx -> value;
                    }
                    if (token.text().equals("(")) {
                        var inner = parseOr();
                        if (!matchOperator(")")) {
                            throw error("Expected ')'");
                        }
                        return inner;
                    }
                    throw new EvaluationException("Unexpected '" + token.text() + "' at position "
                            + token.position() + " in '" + source + "'");
                }
                default -> throw error("Unexpected token");
            }
        }

        private BigDecimal number(Token token) {
            try {
                return new BigDecimal(token.text());
            } catch (NumberFormatException e) {
                throw new EvaluationException("Malformed number '" + token.text() + "'", e);
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private boolean matchOperator(String op) {
            Token token = peek();
            if (token.type() == TokenType.OPERATOR && token.text().equals(op)) {
                index++;
                return true;
            }
            return false;
        }

        private boolean matchWord(String word) {
            Token token = peek();
            if (token.type() == TokenType.IDENT && token.text().equals(word)) {
                index++;
                return true;
            }
            return false;
        }

        private EvaluationException error(String message) {
            return new EvaluationException(message + " at position " + peek().position() + " in '" + source + "'");
        }
    }

    // -- semantics -------------------------------------------------------

    private static Object normalize(Object value) {
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof CharSequence chars) {
            return chars.toString();
        }
        throw new EvaluationException("Unsupported variable type " + value.getClass().getSimpleName());
    }

    private static boolean asBoolean(Object value, String source) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Expected a boolean but got '" + value + "' in '" + source + "'");
    }

    private static boolean compare(Object left, String op, Object right) {
        if (left.getClass() != right.getClass()) {
            throw new EvaluationException("Cannot compare " + left.getClass().getSimpleName()
                    + " with " + right.getClass().getSimpleName());
        }
        if (op.equals("==") || op.equals("=")) {
            return left instanceof BigDecimal l ? l.compareTo((BigDecimal) right) == 0 : left.equals(right);
        }
        if (op.equals("!=")) {
            return left instanceof BigDecimal l ? l.compareTo((BigDecimal) right) != 0 : !left.equals(right);
        }
        if (left instanceof Boolean) {
            throw new EvaluationException("Operator " + op + " is not defined for booleans");
        }
        int cmp = left instanceof BigDecimal l
                ? l.compareTo((BigDecimal) right)
                : ((String) left).compareTo((String) right);
        return switch (op) {
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            default -> throw new EvaluationException("Unknown operator " + op);
        };
    }
}
