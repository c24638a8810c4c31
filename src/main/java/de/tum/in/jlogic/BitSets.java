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

import java.util.BitSet;

final class BitSets {
    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    static int intersectionSize(BitSet set, BitSet other) {
        BitSet copy = copyOf(set);
        copy.and(other);
        return copy.cardinality();
    }

    /**
     * Compares two sets by their elements in ascending order. For sets of equal cardinality, the
     * set containing the smallest element of the symmetric difference is smaller.
     */
    static int lexicographicCompare(BitSet set, BitSet other) {
        BitSet difference = copyOf(set);
        difference.xor(other);
        int first = difference.nextSetBit(0);
        if (first < 0) {
            return 0;
        }
        return set.get(first) ? -1 : 1;
    }
}
