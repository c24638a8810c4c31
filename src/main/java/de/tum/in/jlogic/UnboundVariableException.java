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

import java.util.NoSuchElementException;

/**
 * Thrown when an evaluation references a variable that has no value in the supplied assignment.
 */
public class UnboundVariableException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final String variable;

    public UnboundVariableException(String variable) {
        super("No value for variable " + variable);
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
