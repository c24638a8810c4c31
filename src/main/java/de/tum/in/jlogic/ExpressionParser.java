/*
 * This file is part of JLogic.
 * Copyright (c) 2023 (See AUTHORS)
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Recursive descent parser for textual boolean expressions.
 *
 * <p>Binary operators, from loosest to tightest binding: {@code or} ({@code +}, {@code |},
 * {@code ||}), {@code and} ({@code *}, {@code &}, {@code &&}), {@code xor} ({@code ^}),
 * {@code xnor} ({@code -^}), {@code nor} ({@code -+}) and {@code nand} ({@code -*}). All of them
 * associate to the left. {@code not} ({@code ~}, {@code !}) binds tightest and negates the single
 * operand following it. Operands are identifiers, {@code true}, {@code false} or expressions in
 * round or square brackets. Keywords are case-insensitive.</p>
 */
public final class ExpressionParser {
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "xor", TokenType.XOR,
            "nand", TokenType.NAND,
            "nor", TokenType.NOR,
            "xnor", TokenType.XNOR,
            "not", TokenType.NOT,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE);

    private static final TokenType[] PRECEDENCE = {
        TokenType.OR, TokenType.AND, TokenType.XOR, TokenType.XNOR, TokenType.NOR, TokenType.NAND
    };

    private final List<Token> tokens;
    private int position = 0;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Node parse(String input) throws ParseException {
        ExpressionParser parser = new ExpressionParser(tokenize(input));
        Node node = parser.parseBinary(0);
        Token trailing = parser.peek();
        if (trailing.type != TokenType.END) {
            throw new ParseException("Unexpected " + trailing.describe(), trailing.start);
        }
        return node;
    }

    static boolean isKeyword(String word) {
        return KEYWORDS.containsKey(word.toLowerCase(Locale.ROOT));
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token next() {
        Token token = tokens.get(position);
        if (token.type != TokenType.END) {
            position += 1;
        }
        return token;
    }

    private Node parseBinary(int level) throws ParseException {
        if (level == PRECEDENCE.length) {
            return parseUnary();
        }
        TokenType type = PRECEDENCE[level];
        Node node = parseBinary(level + 1);
        while (peek().type == type) {
            next();
            Node right = parseBinary(level + 1);
            node = new Expression(type.operator(), node, right);
        }
        return node;
    }

    private Node parseUnary() throws ParseException {
        Token token = next();
        switch (token.type) {
            case NOT:
                return parseUnary().negate();
            case IDENTIFIER:
                return new Variable(token.text);
            case TRUE:
                return Constant.TRUE;
            case FALSE:
                return Constant.FALSE;
            case LEFT_PARENTHESIS:
                return parseGroup(TokenType.RIGHT_PARENTHESIS);
            case LEFT_BRACKET:
                return parseGroup(TokenType.RIGHT_BRACKET);
            default:
                throw new ParseException("Expected operand but found " + token.describe(), token.start);
        }
    }

    private Node parseGroup(TokenType closing) throws ParseException {
        Node node = parseBinary(0);
        Token token = next();
        if (token.type != closing) {
            throw new ParseException(
                    "Expected '" + closing.symbol + "' but found " + token.describe(), token.start);
        }
        return node;
    }

    @SuppressWarnings("PMD.CyclomaticComplexity")
    private static List<Token> tokenize(String input) throws ParseException {
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (index < input.length()) {
            char current = input.charAt(index);
            if (Character.isWhitespace(current)) {
                index += 1;
                continue;
            }
            if (isIdentifierStart(current)) {
                int end = index + 1;
                while (end < input.length() && isIdentifierPart(input.charAt(end))) {
                    end += 1;
                }
                String word = input.substring(index, end);
                TokenType keyword = KEYWORDS.get(word.toLowerCase(Locale.ROOT));
                tokens.add(new Token(keyword == null ? TokenType.IDENTIFIER : keyword, word, index));
                index = end;
                continue;
            }

            char following = index + 1 < input.length() ? input.charAt(index + 1) : '\0';
            TokenType type;
            int length = 1;
            switch (current) {
                case '(':
                    type = TokenType.LEFT_PARENTHESIS;
                    break;
                case ')':
                    type = TokenType.RIGHT_PARENTHESIS;
                    break;
                case '[':
                    type = TokenType.LEFT_BRACKET;
                    break;
                case ']':
                    type = TokenType.RIGHT_BRACKET;
                    break;
                case '~':
                case '!':
                    type = TokenType.NOT;
                    break;
                case '+':
                    type = TokenType.OR;
                    break;
                case '|':
                    type = TokenType.OR;
                    length = following == '|' ? 2 : 1;
                    break;
                case '*':
                    type = TokenType.AND;
                    break;
                case '&':
                    type = TokenType.AND;
                    length = following == '&' ? 2 : 1;
                    break;
                case '^':
                    type = TokenType.XOR;
                    break;
                case '-':
                    length = 2;
                    if (following == '^') {
                        type = TokenType.XNOR;
                    } else if (following == '+') {
                        type = TokenType.NOR;
                    } else if (following == '*') {
                        type = TokenType.NAND;
                    } else {
                        throw new ParseException("Unexpected character '-'", index);
                    }
                    break;
                default:
                    throw new ParseException("Unexpected character '" + current + "'", index);
            }
            tokens.add(new Token(type, input.substring(index, index + length), index));
            index += length;
        }
        tokens.add(new Token(TokenType.END, "", input.length()));
        return tokens;
    }

    private static boolean isIdentifierStart(char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z')
                || character == '_';
    }

    private static boolean isIdentifierPart(char character) {
        return isIdentifierStart(character) || (character >= '0' && character <= '9');
    }

    private enum TokenType {
        IDENTIFIER(null, null),
        TRUE(null, null),
        FALSE(null, null),
        NOT(null, null),
        AND(Operator.AND, null),
        OR(Operator.OR, null),
        XOR(Operator.XOR, null),
        NAND(Operator.NAND, null),
        NOR(Operator.NOR, null),
        XNOR(Operator.XNOR, null),
        LEFT_PARENTHESIS(null, "("),
        RIGHT_PARENTHESIS(null, ")"),
        LEFT_BRACKET(null, "["),
        RIGHT_BRACKET(null, "]"),
        END(null, null);

        @Nullable
        private final Operator operator;
        @Nullable
        private final String symbol;

        TokenType(@Nullable Operator operator, @Nullable String symbol) {
            this.operator = operator;
            this.symbol = symbol;
        }

        Operator operator() {
            assert operator != null;
            return operator;
        }
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int start;

        Token(TokenType type, String text, int start) {
            this.type = type;
            this.text = text;
            this.start = start;
        }

        String describe() {
            return type == TokenType.END ? "end of input" : "'" + text + "'";
        }
    }

    /**
     * Signals malformed input. The position is the zero-based index of the offending character, or
     * the input length if the input ended prematurely.
     */
    public static class ParseException extends Exception {
        private static final long serialVersionUID = 1L;

        private final int position;

        public ParseException(String message, int position) {
            super(message + " at position " + position);
            this.position = position;
        }

        public int position() {
            return position;
        }
    }
}
