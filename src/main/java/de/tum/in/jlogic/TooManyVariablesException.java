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

/**
 * Thrown before a truth table or minimization is computed for more variables than the configured
 * limit allows.
 *
 * @see MinimizerConfiguration#maxVariables()
 */
public class TooManyVariablesException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int variableCount;
    private final int limit;

    public TooManyVariablesException(int variableCount, int limit) {
        super(String.format("%d variables exceed the limit of %d", variableCount, limit));
        this.variableCount = variableCount;
        this.limit = limit;
    }

    public int variableCount() {
        return variableCount;
    }

    public int limit() {
        return limit;
    }
}
