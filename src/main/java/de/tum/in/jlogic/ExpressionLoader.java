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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between nodes and nested structured documents, as produced by JSON or YAML readers.
 *
 * <p>Leaves have the shape {@code {"variable": "a", "has_not": true}} or {@code {"constant":
 * false}}, internal nodes {@code {"operator": "or", "left": {...}, "right": {...}, "has_not":
 * false}}. The {@code has_not} key is optional and defaults to {@code false}; operator names are
 * case-insensitive.</p>
 */
public final class ExpressionLoader {
    public static final String VARIABLE = "variable";
    public static final String CONSTANT = "constant";
    public static final String OPERATOR = "operator";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String NEGATED = "has_not";

    private static final String ROOT_PATH = "$";

    private ExpressionLoader() {}

    public static Node load(Map<String, ?> document) throws SchemaException {
        return load(document, ROOT_PATH);
    }

    private static Node load(Object document, String path) throws SchemaException {
        if (!(document instanceof Map)) {
            throw new SchemaException(path, "expected a mapping but found " + describe(document));
        }
        Map<?, ?> map = (Map<?, ?>) document;
        boolean negated = readNegation(map, path);

        int kinds = (map.containsKey(VARIABLE) ? 1 : 0) + (map.containsKey(CONSTANT) ? 1 : 0)
                + (map.containsKey(OPERATOR) ? 1 : 0);
        if (kinds != 1) {
            throw new SchemaException(path,
                    String.format("expected exactly one of '%s', '%s' or '%s'", VARIABLE, CONSTANT, OPERATOR));
        }

        if (map.containsKey(VARIABLE)) {
            Object name = map.get(VARIABLE);
            if (!(name instanceof String) || !Variable.isValidName((String) name)) {
                throw new SchemaException(path, "invalid variable name " + describe(name));
            }
            return new Variable((String) name, negated);
        }
        if (map.containsKey(CONSTANT)) {
            Object value = map.get(CONSTANT);
            if (!(value instanceof Boolean)) {
                throw new SchemaException(path, "constant must be a boolean but found " + describe(value));
            }
            return Constant.of((Boolean) value ^ negated);
        }

        Object operatorName = map.get(OPERATOR);
        Operator operator = operatorName instanceof String ? Operator.byName((String) operatorName) : null;
        if (operator == null) {
            throw new SchemaException(path, "unknown operator " + describe(operatorName));
        }
        if (!map.containsKey(LEFT) || !map.containsKey(RIGHT)) {
            throw new SchemaException(path,
                    String.format("operator requires both '%s' and '%s'", LEFT, RIGHT));
        }
        Node left = load(map.get(LEFT), path + "." + LEFT);
        Node right = load(map.get(RIGHT), path + "." + RIGHT);
        return new Expression(operator, left, right, negated);
    }

    private static boolean readNegation(Map<?, ?> map, String path) throws SchemaException {
        if (!map.containsKey(NEGATED)) {
            return false;
        }
        Object value = map.get(NEGATED);
        if (!(value instanceof Boolean)) {
            throw new SchemaException(path, "'" + NEGATED + "' must be a boolean but found " + describe(value));
        }
        return (Boolean) value;
    }

    private static String describe(Object value) {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }

    /**
     * Converts a node into a document accepted by {@link #load(Map)}. The {@code has_not} key is
     * only written for negated nodes.
     */
    public static Map<String, Object> toDocument(Node node) {
        Map<String, Object> document = new LinkedHashMap<>();
        switch (node.kind()) {
            case VARIABLE:
                document.put(VARIABLE, ((Variable) node).name());
                break;
            case CONSTANT:
                document.put(CONSTANT, ((Constant) node).value());
                break;
            case EXPRESSION:
                Expression expression = (Expression) node;
                document.put(OPERATOR, expression.operator().keyword());
                document.put(LEFT, toDocument(expression.left()));
                document.put(RIGHT, toDocument(expression.right()));
                break;
            default:
                throw new IllegalArgumentException("Unknown node kind " + node.kind());
        }
        if (node.isNegated()) {
            document.put(NEGATED, true);
        }
        return document;
    }

    /**
     * Signals a document which does not describe a node. The path locates the offending
     * sub-document, starting with {@code $} for the root.
     */
    public static class SchemaException extends Exception {
        private static final long serialVersionUID = 1L;

        private final String path;

        public SchemaException(String path, String message) {
            super(path + ": " + message);
            this.path = path;
        }

        public String path() {
            return path;
        }
    }
}
