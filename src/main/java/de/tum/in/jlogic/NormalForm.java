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

import java.util.List;
import javax.annotation.Nullable;

/**
 * The two-level shapes a minimized function is rebuilt in.
 */
public enum NormalForm {
    /**
     * A disjunction of conjunctions, computed from the rows where the function is true.
     */
    SUM_OF_PRODUCTS {
        @Override
        Node minimize(TruthTable table, QuineMcCluskey engine) {
            List<Implicant> cover = engine.minimize(table.variables().size(), table.minterms());
            return join(cover, table.variables(), Operator.OR, Operator.AND, true);
        }
    },
    /**
     * A conjunction of disjunctions, computed from the rows where the function is false.
     */
    PRODUCT_OF_SUMS {
        @Override
        Node minimize(TruthTable table, QuineMcCluskey engine) {
            List<Implicant> cover = engine.minimize(table.variables().size(), table.maxterms());
            return join(cover, table.variables(), Operator.AND, Operator.OR, false);
        }
    },
    /**
     * Whichever of the two other forms has fewer literals, preferring the sum of products.
     */
    SHORTEST {
        @Override
        Node minimize(TruthTable table, QuineMcCluskey engine) {
            Node sum = SUM_OF_PRODUCTS.minimize(table, engine);
            Node product = PRODUCT_OF_SUMS.minimize(table, engine);
            return product.literalCount() < sum.literalCount() ? product : sum;
        }
    };

    abstract Node minimize(TruthTable table, QuineMcCluskey engine);

    /**
     * Builds the outer operation over one inner term per implicant. In a sum of products a fixed
     * {@code 1} becomes the plain variable; in a product of sums a fixed {@code 0} does. Both chains
     * are left-nested and single-element chains stay unwrapped.
     *
     * @param onValue The function value the implicants describe.
     */
    private static Node join(List<Implicant> cover, List<String> variables, Operator outer,
            Operator inner, boolean onValue) {
        if (cover.isEmpty()) {
            return Constant.of(!onValue);
        }
        Node result = null;
        for (Implicant implicant : cover) {
            if (implicant.isUniversal()) {
                return Constant.of(onValue);
            }
            Node term = null;
            for (int i = 0; i < variables.size(); i++) {
                if (implicant.isFixed(i)) {
                    Variable literal = new Variable(variables.get(i), implicant.valueOf(i) != onValue);
                    term = chain(term, literal, inner);
                }
            }
            result = chain(result, term, outer);
        }
        return result;
    }

    private static Node chain(@Nullable Node head, Node next, Operator operator) {
        return head == null ? next : new Expression(operator, head, next);
    }
}
