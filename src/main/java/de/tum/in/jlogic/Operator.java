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

import java.util.Locale;
import javax.annotation.Nullable;

/**
 * The binary connectives an {@link Expression} may combine its operands with.
 */
public enum Operator {
    AND("and") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left && right;
        }
    },
    OR("or") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left || right;
        }
    },
    XOR("xor") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left ^ right;
        }
    },
    NAND("nand") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return !(left && right);
        }
    },
    NOR("nor") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return !(left || right);
        }
    },
    XNOR("xnor") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left == right;
        }
    };

    private final String keyword;

    Operator(String keyword) {
        this.keyword = keyword;
    }

    public abstract boolean apply(boolean left, boolean right);

    /**
     * The lower-case word used for this operator in canonical and functional renderings.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up an operator by its keyword, ignoring case.
     *
     * @return The operator or {@code null} if the name is not recognized.
     */
    @Nullable
    public static Operator byName(String name) {
        String lowerCase = name.toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.keyword.equals(lowerCase)) {
                return operator;
            }
        }
        return null;
    }
}
