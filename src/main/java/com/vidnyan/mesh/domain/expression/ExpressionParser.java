package com.vidnyan.mesh.domain.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the formula language.
 * <p>
 * Binary operators are parsed by precedence climbing:
 * <pre>
 *   or (1) &lt; and (2) &lt; = == != &lt; &lt;= &gt; &gt;= in, not in, like (3) &lt; + - (4) &lt; * / % (5)
 * </pre>
 * Equal-precedence operators associate to the left. The whole input must be consumed.
 * <p>
 * Instances hold no parse state and can be shared.
 */
public final class ExpressionParser {

    public static final Set<String> KEYWORDS = Set.of(
            "if", "then", "else", "true", "false", "null", "and", "or", "in", "not",
            "where", "sum", "count", "avg", "min", "max", "exists");

    private static final int LOWEST_PRECEDENCE = 1;
    private static final int COMPARISON_PRECEDENCE = 3;

    private final boolean strictAggregationSource;

    public ExpressionParser() {
        this(false);
    }

    /**
     * @param strictAggregationSource fail instead of using {@code "Unknown"} when an
     *                                aggregation's source collection cannot be inferred
     */
    public ExpressionParser(boolean strictAggregationSource) {
        this.strictAggregationSource = strictAggregationSource;
    }

    public Expression parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new ParseException("Empty expression", 0);
        }
        Cursor cursor = new Cursor(formula);
        Expression expression = cursor.parseExpression(LOWEST_PRECEDENCE);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw new ParseException("Unexpected trailing input '" + cursor.rest() + "'", cursor.pos);
        }
        return expression;
    }

    private record OperatorMatch(BinaryOperator op, int length) {
    }

    /**
     * Per-call scanning state.
     */
    private final class Cursor {

        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        Expression parseExpression(int minPrecedence) {
            Expression left = parsePrimary();
            while (true) {
                skipWhitespace();
                if (minPrecedence <= COMPARISON_PRECEDENCE && peekWord("is")) {
                    left = parseNullTest(left);
                    continue;
                }
                OperatorMatch match = peekOperator();
                if (match == null || match.op().precedence() < minPrecedence) {
                    return left;
                }
                pos += match.length();
                Expression right = parseExpression(match.op().precedence() + 1);
                left = new Expression.Binary(match.op(), left, right);
            }
        }

        private Expression parseNullTest(Expression operand) {
            int start = pos;
            consumeWord("is");
            skipWhitespace();
            boolean negated = false;
            if (peekWord("not")) {
                consumeWord("not");
                skipWhitespace();
                negated = true;
            }
            if (!peekWord("null")) {
                throw new ParseException("Expected 'null' after 'is'", start);
            }
            consumeWord("null");
            return new Expression.Unary(negated ? UnaryOperator.IS_NOT_NULL : UnaryOperator.IS_NULL, operand);
        }

        /**
         * Infix operator at the current position, or null. Only called where an
         * infix operator is syntactically expected.
         */
        private OperatorMatch peekOperator() {
            if (atEnd()) {
                return null;
            }
            String two = pos + 2 <= text.length() ? text.substring(pos, pos + 2) : "";
            switch (two) {
                case "<=": return new OperatorMatch(BinaryOperator.LE, 2);
                case ">=": return new OperatorMatch(BinaryOperator.GE, 2);
                case "!=": return new OperatorMatch(BinaryOperator.NE, 2);
                case "==": return new OperatorMatch(BinaryOperator.EQ, 2);
                default: break;
            }
            char c = text.charAt(pos);
            switch (c) {
                case '=': return new OperatorMatch(BinaryOperator.EQ, 1);
                case '<': return new OperatorMatch(BinaryOperator.LT, 1);
                case '>': return new OperatorMatch(BinaryOperator.GT, 1);
                case '+': return new OperatorMatch(BinaryOperator.ADD, 1);
                case '-': return new OperatorMatch(BinaryOperator.SUB, 1);
                case '*': return new OperatorMatch(BinaryOperator.MUL, 1);
                case '/': return new OperatorMatch(BinaryOperator.DIV, 1);
                case '%': return new OperatorMatch(BinaryOperator.MOD, 1);
                default: break;
            }
            String word = wordAt(pos);
            switch (word) {
                case "and": return new OperatorMatch(BinaryOperator.AND, 3);
                case "or": return new OperatorMatch(BinaryOperator.OR, 2);
                case "in": return new OperatorMatch(BinaryOperator.IN, 2);
                case "like": return new OperatorMatch(BinaryOperator.LIKE, 4);
                case "not": {
                    int after = pos + 3;
                    while (after < text.length() && Character.isWhitespace(text.charAt(after))) {
                        after++;
                    }
                    String next = wordAt(after);
                    if (next.equals("in")) {
                        return new OperatorMatch(BinaryOperator.NOT_IN, after + 2 - pos);
                    }
                    if (next.equals("like")) {
                        return new OperatorMatch(BinaryOperator.NOT_LIKE, after + 4 - pos);
                    }
                    return null;
                }
                default: return null;
            }
        }

        private Expression parsePrimary() {
            skipWhitespace();
            if (atEnd()) {
                throw new ParseException("Unexpected end of expression", pos);
            }
            char c = text.charAt(pos);

            if (c == '(') {
                pos++;
                Expression inner = parseExpression(LOWEST_PRECEDENCE);
                expect(')');
                return inner;
            }
            if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                return parseNumber();
            }
            if (c == '\'' || c == '"') {
                return parseString(c);
            }
            if (c == '[') {
                return parseList();
            }
            if (c == '-') {
                pos++;
                return new Expression.Unary(UnaryOperator.NEG, parsePrimary());
            }
            if (isIdentifierStart(c)) {
                return parseIdentifier();
            }
            throw new ParseException("Unexpected character '" + c + "'", pos);
        }

        private Expression parseNumber() {
            int start = pos;
            if (text.charAt(pos) == '-') {
                pos++;
            }
            while (!atEnd() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            boolean decimal = false;
            if (!atEnd() && text.charAt(pos) == '.') {
                decimal = true;
                pos++;
                while (!atEnd() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
            String literal = text.substring(start, pos);
            if (decimal) {
                return Expression.Literal.of(new BigDecimal(literal.endsWith(".") ? literal + "0" : literal));
            }
            try {
                return Expression.Literal.of(Long.parseLong(literal));
            } catch (NumberFormatException e) {
                return Expression.Literal.of(new BigDecimal(literal));
            }
        }

        private Expression parseString(char quote) {
            int start = pos;
            pos++;
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    if (pos + 1 >= text.length()) {
                        break;
                    }
                    value.append(text.charAt(pos + 1));
                    pos += 2;
                } else if (c == quote) {
                    pos++;
                    return Expression.Literal.of(value.toString());
                } else {
                    value.append(c);
                    pos++;
                }
            }
            throw new ParseException("Unterminated string literal", start);
        }

        private Expression parseList() {
            pos++;
            List<Expression> items = new ArrayList<>();
            skipWhitespace();
            if (!atEnd() && text.charAt(pos) == ']') {
                pos++;
                return new Expression.ListLiteral(items);
            }
            items.add(parseExpression(LOWEST_PRECEDENCE));
            skipWhitespace();
            while (!atEnd() && text.charAt(pos) == ',') {
                pos++;
                items.add(parseExpression(LOWEST_PRECEDENCE));
                skipWhitespace();
            }
            expect(']');
            return new Expression.ListLiteral(items);
        }

        private Expression parseIdentifier() {
            int start = pos;
            String name = readIdentifier();

            switch (name) {
                case "if":
                    return parseConditional();
                case "true":
                    return Expression.Literal.of(Boolean.TRUE);
                case "false":
                    return Expression.Literal.of(Boolean.FALSE);
                case "null":
                    return Expression.Literal.NULL;
                case "not":
                    return new Expression.Unary(UnaryOperator.NOT, parseExpression(COMPARISON_PRECEDENCE));
                default:
                    break;
            }

            Optional<AggregationOperator> aggregation = AggregationOperator.fromWireName(name);
            if (aggregation.isPresent()) {
                skipWhitespace();
                if (!atEnd() && text.charAt(pos) == '(') {
                    pos++;
                    return parseAggregation(aggregation.get());
                }
            }
            if (KEYWORDS.contains(name)) {
                throw new ParseException("Reserved keyword '" + name + "' cannot be used as an identifier", start);
            }

            if (!atEnd() && (text.charAt(pos) == '.' || text.charAt(pos) == '[')) {
                return parseReference(name);
            }

            int beforeWhitespace = pos;
            skipWhitespace();
            if (!atEnd() && text.charAt(pos) == '(') {
                pos++;
                return new Expression.Call(name, parseArguments());
            }
            pos = beforeWhitespace;
            return new Expression.InputRef(name);
        }

        private Expression parseConditional() {
            Expression cond = parseExpression(LOWEST_PRECEDENCE);
            expectKeyword("then");
            Expression then = parseExpression(LOWEST_PRECEDENCE);
            expectKeyword("else");
            Expression otherwise = parseExpression(LOWEST_PRECEDENCE);
            return new Expression.If(cond, then, otherwise);
        }

        private Expression parseReference(String root) {
            StringBuilder path = new StringBuilder(root);
            List<String> segments = new ArrayList<>();
            segments.add(root);
            readIndexSuffix(path);
            while (!atEnd() && text.charAt(pos) == '.') {
                int dot = pos;
                pos++;
                if (atEnd() || !isIdentifierStart(text.charAt(pos))) {
                    throw new ParseException("Expected identifier after '.'", dot);
                }
                String segment = readIdentifier();
                segments.add(segment);
                path.append('.').append(segment);
                readIndexSuffix(path);
            }
            if (segments.size() > 1 && root.equals("self")) {
                return new Expression.SelfRef(path.substring("self.".length()));
            }
            if (segments.size() > 1 && root.equals("input")) {
                return new Expression.InputRef(path.substring("input.".length()));
            }
            return new Expression.FieldRef(path.toString());
        }

        /**
         * Copies a {@code [...]} suffix verbatim, honouring nested brackets.
         */
        private void readIndexSuffix(StringBuilder path) {
            while (!atEnd() && text.charAt(pos) == '[') {
                int start = pos;
                int depth = 0;
                do {
                    char c = text.charAt(pos);
                    if (c == '[') {
                        depth++;
                    } else if (c == ']') {
                        depth--;
                    }
                    pos++;
                } while (depth > 0 && !atEnd());
                if (depth > 0) {
                    throw new ParseException("Unclosed '['", start);
                }
                path.append(text, start, pos);
            }
        }

        private List<Expression> parseArguments() {
            List<Expression> args = new ArrayList<>();
            skipWhitespace();
            if (!atEnd() && text.charAt(pos) == ')') {
                pos++;
                return args;
            }
            args.add(parseExpression(LOWEST_PRECEDENCE));
            skipWhitespace();
            while (!atEnd() && text.charAt(pos) == ',') {
                pos++;
                args.add(parseExpression(LOWEST_PRECEDENCE));
                skipWhitespace();
            }
            expect(')');
            return args;
        }

        private Expression parseAggregation(AggregationOperator op) {
            int start = pos;
            skipWhitespace();

            if (op.takesCollection() && !atEnd() && isIdentifierStart(text.charAt(pos))) {
                int identifierStart = pos;
                String collection = readIdentifier();
                skipWhitespace();
                boolean bare = !KEYWORDS.contains(collection)
                        && !atEnd() && (text.charAt(pos) == ')' || peekWord("where"));
                if (bare) {
                    Expression where = parseWhere();
                    expect(')');
                    return new Expression.Aggregation(op, collection, null, where, Confidence.EXPLICIT);
                }
                pos = identifierStart;
            }

            Expression item = parseExpression(LOWEST_PRECEDENCE);
            skipWhitespace();
            Expression where = parseWhere();
            expect(')');

            String source = inferSource(item).map(EntityNames::toEntityName).orElse(null);
            if (source == null) {
                if (strictAggregationSource) {
                    throw new ParseException("Cannot infer source collection of '" + op.wireName() + "'", start);
                }
                source = Expression.Aggregation.UNKNOWN_SOURCE;
            }
            return new Expression.Aggregation(op, source, item, where, Confidence.INFERRED);
        }

        private Expression parseWhere() {
            skipWhitespace();
            if (peekWord("where")) {
                consumeWord("where");
                return parseExpression(LOWEST_PRECEDENCE);
            }
            return null;
        }

        private void expect(char expected) {
            skipWhitespace();
            if (atEnd()) {
                throw new ParseException("Expected '" + expected + "' but reached end of expression", pos);
            }
            if (text.charAt(pos) != expected) {
                throw new ParseException("Expected '" + expected + "' but found '" + text.charAt(pos) + "'", pos);
            }
            pos++;
        }

        private void expectKeyword(String keyword) {
            skipWhitespace();
            if (!peekWord(keyword)) {
                throw new ParseException("Expected '" + keyword + "'", pos);
            }
            consumeWord(keyword);
        }

        private boolean peekWord(String word) {
            return wordAt(pos).equals(word);
        }

        private void consumeWord(String word) {
            pos += word.length();
        }

        /**
         * The whole identifier-like word starting at {@code index}, or "" if none.
         */
        private String wordAt(int index) {
            if (index >= text.length() || !isIdentifierStart(text.charAt(index))) {
                return "";
            }
            int end = index;
            while (end < text.length() && isIdentifierPart(text.charAt(end))) {
                end++;
            }
            return text.substring(index, end);
        }

        private String readIdentifier() {
            String word = wordAt(pos);
            pos += word.length();
            return word;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        String rest() {
            return text.substring(pos);
        }
    }

    /**
     * Left-most entity reference of an aggregated expression.
     */
    static Optional<String> inferSource(Expression expression) {
        if (expression instanceof Expression.FieldRef ref) {
            return Optional.of(ref.root());
        }
        if (expression instanceof Expression.Binary binary) {
            Optional<String> left = inferSource(binary.left());
            return left.isPresent() ? left : inferSource(binary.right());
        }
        if (expression instanceof Expression.Unary unary) {
            return inferSource(unary.expr());
        }
        return Optional.empty();
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
