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

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A binary operation over two operand nodes. The negation flag applies to the combined result.
 */
public final class Expression extends Node {
    private final Operator operator;
    private final Node left;
    private final Node right;
    private final boolean negated;
    private final int depth;

    public Expression(Operator operator, Node left, Node right) {
        this(operator, left, right, false);
    }

    public Expression(Operator operator, Node left, Node right, boolean negated) {
        this.operator = Objects.requireNonNull(operator);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
        this.negated = negated;
        this.depth = Math.max(left.depth(), right.depth()) + 1;
    }

    public static Expression and(Node left, Node right) {
        return new Expression(Operator.AND, left, right);
    }

    public static Expression or(Node left, Node right) {
        return new Expression(Operator.OR, left, right);
    }

    public Operator operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public Kind kind() {
        return Kind.EXPRESSION;
    }

    @Override
    public boolean evaluate(Map<String, Boolean> assignment) {
        boolean leftValue = left.evaluate(assignment);
        boolean rightValue = right.evaluate(assignment);
        return operator.apply(leftValue, rightValue) ^ negated;
    }

    @Override
    public boolean isNegated() {
        return negated;
    }

    @Override
    public Expression negate() {
        return new Expression(operator, left, right, !negated);
    }

    @Override
    void gatherVariables(Set<String> names) {
        left.gatherVariables(names);
        right.gatherVariables(names);
    }

    @Override
    public int literalCount() {
        return left.literalCount() + right.literalCount();
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public String toCanonicalString() {
        String infix = left.toCanonicalString() + " " + operator.keyword() + " "
                + right.toCanonicalString();
        return negated ? "not(" + infix + ")" : "(" + infix + ")";
    }

    @Override
    public String toFunctionalString() {
        String prefix = operator.keyword() + "(" + left.toFunctionalString() + ", "
                + right.toFunctionalString() + ")";
        return negated ? "not(" + prefix + ")" : prefix;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Expression)) {
            return false;
        }
        Expression that = (Expression) object;
        return operator == that.operator && negated == that.negated
                && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right, negated);
    }
}
