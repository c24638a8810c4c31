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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class OperatorTest {
    /**
     * Results for the inputs (0, 0), (0, 1), (1, 0) and (1, 1).
     */
    public static Stream<Arguments> truthTables() {
        return Stream.of(
                Arguments.of(Operator.AND, new boolean[] {false, false, false, true}),
                Arguments.of(Operator.OR, new boolean[] {false, true, true, true}),
                Arguments.of(Operator.XOR, new boolean[] {false, true, true, false}),
                Arguments.of(Operator.NAND, new boolean[] {true, true, true, false}),
                Arguments.of(Operator.NOR, new boolean[] {true, false, false, false}),
                Arguments.of(Operator.XNOR, new boolean[] {true, false, false, true}));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("truthTables")
    public void testApply(Operator operator, boolean[] expected) {
        for (int row = 0; row < 4; row++) {
            boolean left = (row & 2) != 0;
            boolean right = (row & 1) != 0;
            assertThat(operator + " " + row, operator.apply(left, right), is(expected[row]));
        }
    }

    @Test
    public void testByName() {
        assertThat(Operator.byName("and"), is(Operator.AND));
        assertThat(Operator.byName("XNOR"), is(Operator.XNOR));
        assertThat(Operator.byName("Nor"), is(Operator.NOR));
        assertThat(Operator.byName("implies"), nullValue());
    }
}
