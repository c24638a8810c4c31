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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class MinimizerConfiguration {
    public static final int DEFAULT_MAX_VARIABLES = 20;

    public enum CoverStrategy {
        /**
         * Repeatedly picks the prime implicant covering most of the remaining minterms. Not
         * guaranteed to find a cover of minimum size.
         */
        GREEDY,
        /**
         * Branch and bound search for a cover with the fewest implicants, then the fewest literals.
         */
        EXACT
    }

    public static MinimizerConfiguration defaults() {
        return ImmutableMinimizerConfiguration.builder().build();
    }

    /**
     * Upper bound on the number of distinct variables a truth table or minimization is computed
     * for. Work grows exponentially with this number.
     */
    @Value.Default
    public int maxVariables() {
        return DEFAULT_MAX_VARIABLES;
    }

    @Value.Default
    public boolean parallel() {
        return false;
    }

    @Value.Default
    public CoverStrategy coverStrategy() {
        return CoverStrategy.GREEDY;
    }

    @Value.Check
    protected void check() {
        if (maxVariables() < 0 || maxVariables() > Implicant.MAX_WIDTH) {
            throw new IllegalArgumentException(String.format(
                    "maxVariables must be between 0 and %d, got %d", Implicant.MAX_WIDTH, maxVariables()));
        }
    }

    void checkVariableCount(int variableCount) {
        if (variableCount > maxVariables()) {
            throw new TooManyVariablesException(variableCount, maxVariables());
        }
    }
}
