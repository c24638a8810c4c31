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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of a boolean expression tree. The hierarchy is closed: every node is either a {@link
 * Variable}, an {@link Expression} or a {@link Constant}, as reported by {@link #kind()}. Nodes are
 * immutable and compare structurally.
 *
 * <p>The package-private constructor keeps other subclasses out, so a switch over {@link Kind}
 * covering all three constants handles every node. A new kind has to be added to each such switch,
 * in particular {@link ExpressionLoader#toDocument(Node)}.</p>
 */
public abstract class Node {
    public enum Kind {
        VARIABLE,
        EXPRESSION,
        CONSTANT
    }

    Node() {
        // Only the three node kinds of this package may extend this class
    }

    public abstract Kind kind();

    /**
     * Evaluates this node under the given assignment. Names not referenced by this node are ignored.
     *
     * @param assignment The truth value of each variable.
     * @return The value of this node.
     * @throws UnboundVariableException If a referenced variable is missing from {@code assignment}.
     */
    public abstract boolean evaluate(Map<String, Boolean> assignment);

    /**
     * Whether a negation is applied on top of this node. Constants never carry a negation flag.
     */
    public abstract boolean isNegated();

    /**
     * Returns a node which evaluates to the negation of this node. The negation flag is toggled, a
     * constant is flipped.
     */
    public abstract Node negate();

    /**
     * Returns the names of all variables occurring in this node, deduplicated, in the order of their
     * first occurrence during a depth-first, left-to-right traversal.
     */
    public List<String> collectVariableNames() {
        Set<String> names = new LinkedHashSet<>();
        gatherVariables(names);
        return List.copyOf(names);
    }

    abstract void gatherVariables(Set<String> names);

    /**
     * Number of variable occurrences (leaves) in this node.
     */
    public abstract int literalCount();

    public abstract int depth();

    /**
     * Renders this node in parenthesized infix form, e.g. {@code (a or not(b))}. The result is
     * accepted by {@link ExpressionParser} and parses back to an equal node.
     */
    public abstract String toCanonicalString();

    /**
     * Renders this node in prefix form, e.g. {@code or(a, not(b))}.
     */
    public abstract String toFunctionalString();

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
