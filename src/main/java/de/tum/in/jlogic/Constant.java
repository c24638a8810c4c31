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
import java.util.Set;

/**
 * The constants {@code true} and {@code false}. Minimization yields a constant when the function
 * is a tautology or a contradiction.
 */
public final class Constant extends Node {
    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    private final boolean value;

    private Constant(boolean value) {
        this.value = value;
    }

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.CONSTANT;
    }

    @Override
    public boolean evaluate(Map<String, Boolean> assignment) {
        return value;
    }

    @Override
    public boolean isNegated() {
        return false;
    }

    @Override
    public Constant negate() {
        return of(!value);
    }

    @Override
    void gatherVariables(Set<String> names) {
        // No variables in this leaf
    }

    @Override
    public int literalCount() {
        return 0;
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String toCanonicalString() {
        return String.valueOf(value);
    }

    @Override
    public String toFunctionalString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object object) {
        return this == object || (object instanceof Constant && ((Constant) object).value == value);
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
