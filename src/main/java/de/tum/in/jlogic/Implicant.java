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

import javax.annotation.Nullable;

/**
 * A product term over a fixed number of variables, written as a pattern over {@code 0}, {@code 1}
 * and {@code -} (don't care). Variable {@code i} of {@code width} variables is stored at bit
 * {@code width - 1 - i}, so that the pattern of a minterm read as a binary number is the index of
 * the corresponding truth table row.
 */
public final class Implicant {
    /**
     * Largest supported width; minterm indices have to fit into a non-negative {@code int}.
     */
    public static final int MAX_WIDTH = 30;

    private final int width;
    private final int bits;
    private final int mask;

    private Implicant(int width, int bits, int mask) {
        assert (bits & ~mask) == 0;
        this.width = width;
        this.bits = bits;
        this.mask = mask;
    }

    public static Implicant ofMinterm(int width, int minterm) {
        checkWidth(width);
        int mask = width == 0 ? 0 : -1 >>> (Integer.SIZE - width);
        if ((minterm & ~mask) != 0 || minterm < 0) {
            throw new IllegalArgumentException(
                    String.format("Minterm %d out of range for %d variables", minterm, width));
        }
        return new Implicant(width, minterm, mask);
    }

    /**
     * Reads a pattern such as {@code "1-0"}, where the first character belongs to variable 0.
     */
    public static Implicant parse(String pattern) {
        int width = pattern.length();
        checkWidth(width);
        int bits = 0;
        int mask = 0;
        for (int i = 0; i < width; i++) {
            int bit = 1 << (width - 1 - i);
            switch (pattern.charAt(i)) {
                case '1':
                    bits |= bit;
                    mask |= bit;
                    break;
                case '0':
                    mask |= bit;
                    break;
                case '-':
                    break;
                default:
                    throw new IllegalArgumentException("Invalid pattern " + pattern);
            }
        }
        return new Implicant(width, bits, mask);
    }

    private static void checkWidth(int width) {
        if (width < 0 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("Unsupported width " + width);
        }
    }

    public int width() {
        return width;
    }

    /**
     * Number of positive literals, the key by which implicants are grouped when combining.
     */
    public int ones() {
        return Integer.bitCount(bits);
    }

    public int literalCount() {
        return Integer.bitCount(mask);
    }

    public int dontCareCount() {
        return width - literalCount();
    }

    /**
     * Whether the given variable is fixed by this implicant.
     */
    public boolean isFixed(int variable) {
        return (mask & bit(variable)) != 0;
    }

    /**
     * The value of a fixed variable.
     */
    public boolean valueOf(int variable) {
        assert isFixed(variable);
        return (bits & bit(variable)) != 0;
    }

    private int bit(int variable) {
        assert 0 <= variable && variable < width;
        return 1 << (width - 1 - variable);
    }

    /**
     * The implicant with every position a don't care, covering every minterm.
     */
    public boolean isUniversal() {
        return mask == 0;
    }

    public boolean covers(int minterm) {
        return (minterm & mask) == bits;
    }

    /**
     * Merges two implicants which fix the same positions and differ in exactly one of them.
     *
     * @return The merged implicant with that position as don't care, or {@code null} if the two
     *     implicants cannot be merged.
     */
    @Nullable
    public Implicant combine(Implicant other) {
        if (width != other.width || mask != other.mask) {
            return null;
        }
        int difference = bits ^ other.bits;
        if (Integer.bitCount(difference) != 1) {
            return null;
        }
        return new Implicant(width, bits & ~difference, mask & ~difference);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return width == that.width && bits == that.bits && mask == that.mask;
    }

    @Override
    public int hashCode() {
        return (31 * width + bits) * 31 + mask;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(width);
        for (int i = 0; i < width; i++) {
            builder.append(isFixed(i) ? (valueOf(i) ? '1' : '0') : '-');
        }
        return builder.toString();
    }
}
