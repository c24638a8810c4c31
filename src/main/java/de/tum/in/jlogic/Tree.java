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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * A boolean expression with its root node. Trees are immutable; {@link #simplify()} returns a new
 * tree.
 *
 * <p>Variables are ordered by first occurrence in a depth-first, left-to-right traversal of the
 * root. This ordering determines the rows of {@link #truthTable()} and the order of literals in
 * simplified expressions. A simplified tree keeps the variables of the tree it was computed from,
 * including those its root no longer mentions, so both have the same truth table and simplifying
 * it again yields the same expression.</p>
 */
public final class Tree {
    private final Node root;
    private final List<String> variables;

    private Tree(Node root) {
        this(root, root.collectVariableNames());
    }

    private Tree(Node root, List<String> variables) {
        assert variables.containsAll(root.collectVariableNames());
        this.root = root;
        this.variables = variables;
    }

    public static Tree of(Node root) {
        return new Tree(Objects.requireNonNull(root));
    }

    public static Tree parse(String expression) throws ExpressionParser.ParseException {
        return new Tree(ExpressionParser.parse(expression));
    }

    public static Tree load(Map<String, ?> document) throws ExpressionLoader.SchemaException {
        return new Tree(ExpressionLoader.load(document));
    }

    public Node root() {
        return root;
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * Evaluates the root under the given assignment.
     *
     * @throws UnboundVariableException If a variable of this tree has no value.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return root.evaluate(assignment);
    }

    public TruthTable truthTable() {
        return truthTable(MinimizerConfiguration.defaults());
    }

    /**
     * Evaluates the root for all {@code 2^k} assignments of the {@code k} variables of this tree.
     *
     * @throws TooManyVariablesException If {@code k} exceeds the configured limit.
     */
    public TruthTable truthTable(MinimizerConfiguration configuration) {
        configuration.checkVariableCount(variables.size());
        return new TruthTable(variables, evaluateAll(root, variables, configuration), root.toCanonicalString());
    }

    private static boolean[] evaluateAll(Node node, List<String> variables,
            MinimizerConfiguration configuration) {
        boolean[] results = new boolean[1 << variables.size()];
        IntStream rows = IntStream.range(0, results.length);
        if (configuration.parallel()) {
            rows = rows.parallel();
        }
        rows.forEach(index -> results[index] = node.evaluate(TruthTable.assignment(variables, index)));
        return results;
    }

    /**
     * Minimizes this tree into a sum of products with the default configuration.
     *
     * @see #simplify(NormalForm, MinimizerConfiguration)
     */
    public Tree simplify() {
        return simplify(NormalForm.SUM_OF_PRODUCTS, MinimizerConfiguration.defaults());
    }

    public Tree simplify(NormalForm form) {
        return simplify(form, MinimizerConfiguration.defaults());
    }

    /**
     * Computes a minimal two-level form of this tree. Functions which are always true or always
     * false yield a tree whose root is a {@link Constant}.
     *
     * @throws TooManyVariablesException If this tree has more variables than the configured limit.
     */
    public Tree simplify(NormalForm form, MinimizerConfiguration configuration) {
        TruthTable table = truthTable(configuration);
        return new Tree(form.minimize(table, new QuineMcCluskey(configuration)), variables);
    }

    /**
     * Checks whether both trees evaluate to the same value for every assignment of the variables
     * occurring in either tree.
     *
     * @throws TooManyVariablesException If the trees together have more variables than the default
     *     limit.
     */
    public boolean isEquivalentTo(Tree other) {
        return isEquivalentTo(other, MinimizerConfiguration.defaults());
    }

    /**
     * Checks equivalence as {@link #isEquivalentTo(Tree)}, bounding the number of variables by the
     * given configuration.
     *
     * @throws TooManyVariablesException If the trees together have more variables than the
     *     configured limit.
     */
    public boolean isEquivalentTo(Tree other, MinimizerConfiguration configuration) {
        Set<String> union = new LinkedHashSet<>(variables);
        union.addAll(other.variables);
        List<String> names = new ArrayList<>(union);
        configuration.checkVariableCount(names.size());
        for (int index = 0; index < 1 << names.size(); index++) {
            Map<String, Boolean> assignment = TruthTable.assignment(names, index);
            if (root.evaluate(assignment) != other.root.evaluate(assignment)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Tree)) {
            return false;
        }
        Tree that = (Tree) object;
        return root.equals(that.root) && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return 31 * root.hashCode() + variables.hashCode();
    }

    @Override
    public String toString() {
        return root.toCanonicalString();
    }
}
