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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The value of a function for every assignment of its variables. Row {@code i} assigns variable
 * {@code j} of {@code k} variables the value of bit {@code k - 1 - j} of {@code i}, i.e. rows are
 * in binary counting order with the first variable most significant.
 */
public final class TruthTable {
    private final List<String> variables;
    private final boolean[] results;
    private final String label;

    TruthTable(List<String> variables, boolean[] results, String label) {
        assert results.length == 1 << variables.size();
        this.variables = List.copyOf(variables);
        this.results = results;
        this.label = label;
    }

    /**
     * Builds the assignment of row {@code index}.
     */
    static Map<String, Boolean> assignment(List<String> variables, int index) {
        int count = variables.size();
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            assignment.put(variables.get(i), (index & (1 << (count - 1 - i))) != 0);
        }
        return Collections.unmodifiableMap(assignment);
    }

    public List<String> variables() {
        return variables;
    }

    public int size() {
        return results.length;
    }

    public boolean result(int index) {
        return results[index];
    }

    public Row row(int index) {
        Objects.checkIndex(index, results.length);
        return new Row(index, assignment(variables, index), results[index]);
    }

    public List<Row> rows() {
        return new AbstractList<>() {
            @Override
            public Row get(int index) {
                return row(index);
            }

            @Override
            public int size() {
                return results.length;
            }
        };
    }

    /**
     * Indices of the rows where the function is true.
     */
    public BitSet minterms() {
        BitSet minterms = new BitSet(results.length);
        for (int i = 0; i < results.length; i++) {
            if (results[i]) {
                minterms.set(i);
            }
        }
        return minterms;
    }

    /**
     * Indices of the rows where the function is false.
     */
    public BitSet maxterms() {
        BitSet maxterms = minterms();
        maxterms.flip(0, results.length);
        return maxterms;
    }

    public boolean isTautology() {
        return minterms().cardinality() == results.length;
    }

    public boolean isContradiction() {
        return minterms().isEmpty();
    }

    /**
     * Renders the table with one column per variable and a final column for the result, e.g.
     *
     * <pre>
     * | a | b | (a and b) |
     * +---+---+-----------+
     * | 0 | 0 |     0     |
     * </pre>
     */
    public String format() {
        List<String> header = new ArrayList<>(variables);
        header.add(label);

        StringBuilder builder = new StringBuilder();
        appendRow(builder, header, header);
        builder.append('\n').append('+');
        for (String column : header) {
            builder.append("-".repeat(column.length() + 2)).append('+');
        }
        for (int index = 0; index < results.length; index++) {
            List<String> cells = new ArrayList<>(header.size());
            for (int i = 0; i < variables.size(); i++) {
                cells.add((index & (1 << (variables.size() - 1 - i))) != 0 ? "1" : "0");
            }
            cells.add(results[index] ? "1" : "0");
            builder.append('\n');
            appendRow(builder, header, cells);
        }
        return builder.toString();
    }

    private static void appendRow(StringBuilder builder, List<String> header, List<String> cells) {
        builder.append('|');
        for (int i = 0; i < header.size(); i++) {
            builder.append(' ').append(center(cells.get(i), header.get(i).length())).append(" |");
        }
    }

    private static String center(String text, int width) {
        int padding = Math.max(0, width - text.length());
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TruthTable)) {
            return false;
        }
        TruthTable that = (TruthTable) object;
        return variables.equals(that.variables) && Arrays.equals(results, that.results);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.hashCode(results);
    }

    @Override
    public String toString() {
        return format();
    }

    public static final class Row {
        private final int index;
        private final Map<String, Boolean> assignment;
        private final boolean result;

        Row(int index, Map<String, Boolean> assignment, boolean result) {
            this.index = index;
            this.assignment = assignment;
            this.result = result;
        }

        public int index() {
            return index;
        }

        public Map<String, Boolean> assignment() {
            return assignment;
        }

        public boolean result() {
            return result;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Row)) {
                return false;
            }
            Row that = (Row) object;
            return index == that.index && result == that.result && assignment.equals(that.assignment);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, assignment, result);
        }

        @Override
        public String toString() {
            return assignment + " -> " + result;
        }
    }
}
