package com.deepansh.assistant.tool.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent evaluator for the calculator tool.
 *
 * Grammar (lowest to highest precedence):
 * <pre>
 *   expression := term (('+' | '-') term)*
 *   term       := unary (('*' | '/' | '//' | '%') unary)*
 *   unary      := ('+' | '-') unary | power
 *   power      := primary (('**' | '^') unary)?
 *   primary    := number | constant | function '(' args ')' | '(' expression ')'
 * </pre>
 * Exponentiation is right-associative and binds tighter than unary minus,
 * so {@code -2**2} is -4.
 *
 * Only the listed functions and constants are reachable; no names are
 * resolved against anything else. Nesting (signs, parentheses, exponents,
 * function arguments) is capped at {@value #MAX_DEPTH} levels.
 */
final class ExpressionEvaluator {

    static final int MAX_DEPTH = 200;

    private final String source;
    private int pos;
    private int depth;

    private ExpressionEvaluator(String source) {
        this.source = source;
    }

    static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("empty expression");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < evaluator.source.length()) {
            throw new IllegalArgumentException("unexpected character '" + evaluator.source.charAt(evaluator.pos)
                    + "' at position " + evaluator.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return value;
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume("+")) {
                value += parseTerm();
            } else if (consume("-")) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseUnary();
        while (true) {
            if (consume("*")) {
                value *= parseUnary();
            } else if (consume("//")) {
                value = Math.floor(value / nonZero(parseUnary()));
            } else if (consume("/")) {
                value /= nonZero(parseUnary());
            } else if (consume("%")) {
                double divisor = nonZero(parseUnary());
                value = value - divisor * Math.floor(value / divisor);
            } else {
                return value;
            }
        }
    }

    private double parseUnary() {
        if (++depth > MAX_DEPTH) {
            throw new IllegalArgumentException("expression too deeply nested");
        }
        try {
            if (consume("+")) {
                return parseUnary();
            }
            if (consume("-")) {
                return -parseUnary();
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private double parsePower() {
        double base = parsePrimary();
        if (consume("**") || consume("^")) {
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw new IllegalArgumentException("unexpected end of expression");
        }
        char c = source.charAt(pos);
        if (c == '(') {
            pos++;
            double value = parseExpression();
            expect(")");
            return value;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            String name = parseIdentifier();
            if (consume("(")) {
                return applyFunction(name, parseArguments());
            }
            return constant(name);
        }
        throw new IllegalArgumentException("unexpected character '" + c + "' at position " + pos);
    }

    private double parseNumber() {
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String literal = source.substring(start, pos);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number '" + literal + "'");
        }
    }

    private String parseIdentifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return source.substring(start, pos).toLowerCase(Locale.ROOT);
    }

    private List<Double> parseArguments() {
        List<Double> args = new ArrayList<>();
        if (consume(")")) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (consume(","));
        expect(")");
        return args;
    }

    private static double constant(String name) {
        return switch (name) {
            case "pi" -> Math.PI;
            case "e" -> Math.E;
            default -> throw new IllegalArgumentException("name '" + name + "' is not defined");
        };
    }

    private static double applyFunction(String name, List<Double> args) {
        return switch (name) {
            case "abs" -> Math.abs(single(name, args));
            case "sqrt" -> {
                double x = single(name, args);
                if (x < 0) throw new ArithmeticException("math domain error");
                yield Math.sqrt(x);
            }
            case "sin" -> Math.sin(single(name, args));
            case "cos" -> Math.cos(single(name, args));
            case "tan" -> Math.tan(single(name, args));
            case "exp" -> Math.exp(single(name, args));
            case "log10" -> Math.log10(positive(single(name, args)));
            case "log" -> {
                if (args.size() == 2) {
                    yield Math.log(positive(args.get(0))) / Math.log(positive(args.get(1)));
                }
                yield Math.log(positive(single(name, args)));
            }
            case "pow" -> {
                arity(name, args, 2);
                yield Math.pow(args.get(0), args.get(1));
            }
            case "round" -> {
                if (args.size() == 2) {
                    double scale = Math.pow(10, args.get(1).intValue());
                    yield Math.rint(args.get(0) * scale) / scale;
                }
                yield Math.rint(single(name, args));
            }
            case "min" -> atLeastOne(name, args).stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case "max" -> atLeastOne(name, args).stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case "sum" -> args.stream().mapToDouble(Double::doubleValue).sum();
            default -> throw new IllegalArgumentException("unknown function '" + name + "'");
        };
    }

    private static double single(String name, List<Double> args) {
        arity(name, args, 1);
        return args.get(0);
    }

    private static void arity(String name, List<Double> args, int expected) {
        if (args.size() != expected) {
            throw new IllegalArgumentException(name + "() takes " + expected + " argument(s), got " + args.size());
        }
    }

    private static List<Double> atLeastOne(String name, List<Double> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name + "() expects at least 1 argument");
        }
        return args;
    }

    private static double positive(double x) {
        if (x <= 0) throw new ArithmeticException("math domain error");
        return x;
    }

    private static double nonZero(double divisor) {
        if (divisor == 0) throw new ArithmeticException("division by zero");
        return divisor;
    }

    private boolean peek(String token) {
        skipWhitespace();
        return source.startsWith(token, pos);
    }

    private boolean consume(String token) {
        if (peek(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!consume(token)) {
            throw new IllegalArgumentException("expected '" + token + "' at position " + pos);
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
