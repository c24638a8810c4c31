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
import java.util.regex.Pattern;

/**
 * A named boolean atom, optionally negated. Two variables with the same name refer to the same
 * value during evaluation.
 */
public final class Variable extends Node {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final boolean negated;

    public Variable(String name) {
        this(name, false);
    }

    public Variable(String name, boolean negated) {
        Objects.requireNonNull(name);
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid variable name '" + name + "'");
        }
        this.name = name;
        this.negated = negated;
    }

    /**
     * Checks whether {@code name} is an identifier which is not one of the parser keywords.
     */
    public static boolean isValidName(String name) {
        return NAME.matcher(name).matches() && !ExpressionParser.isKeyword(name);
    }

    public String name() {
        return name;
    }

    @Override
    public Kind kind() {
        return Kind.VARIABLE;
    }

    @Override
    public boolean evaluate(Map<String, Boolean> assignment) {
        Boolean value = assignment.get(name);
        if (value == null) {
            throw new UnboundVariableException(name);
        }
        return value ^ negated;
    }

    @Override
    public boolean isNegated() {
        return negated;
    }

    @Override
    public Variable negate() {
        return new Variable(name, !negated);
    }

    @Override
    void gatherVariables(Set<String> names) {
        names.add(name);
    }

    @Override
    public int literalCount() {
        return 1;
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String toCanonicalString() {
        return negated ? "not(" + name + ")" : name;
    }

    @Override
    public String toFunctionalString() {
        return toCanonicalString();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Variable)) {
            return false;
        }
        Variable that = (Variable) object;
        return negated == that.negated && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, negated);
    }
}
