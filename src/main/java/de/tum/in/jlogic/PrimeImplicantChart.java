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

import de.tum.in.jlogic.MinimizerConfiguration.CoverStrategy;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The coverage table of a set of prime implicants: one row per prime, one column per minterm,
 * and the selection of a cover from it.
 */
final class PrimeImplicantChart {
    private final List<Implicant> primes;
    private final int[] minterms;
    private final BitSet[] rows;

    PrimeImplicantChart(List<Implicant> primes, BitSet minterms) {
        this.primes = List.copyOf(primes);
        this.minterms = minterms.stream().toArray();
        this.rows = new BitSet[primes.size()];
        for (int prime = 0; prime < rows.length; prime++) {
            Implicant implicant = this.primes.get(prime);
            BitSet row = new BitSet(this.minterms.length);
            for (int column = 0; column < this.minterms.length; column++) {
                if (implicant.covers(this.minterms[column])) {
                    row.set(column);
                }
            }
            rows[prime] = row;
        }
    }

    int primeCount() {
        return rows.length;
    }

    int mintermCount() {
        return minterms.length;
    }

    int minterm(int column) {
        return minterms[column];
    }

    boolean covers(int prime, int column) {
        return rows[prime].get(column);
    }

    /**
     * Indices of all primes covering the given column.
     */
    BitSet coveringPrimes(int column) {
        BitSet covering = new BitSet(rows.length);
        for (int prime = 0; prime < rows.length; prime++) {
            if (rows[prime].get(column)) {
                covering.set(prime);
            }
        }
        return covering;
    }

    /**
     * Indices of all primes which are the only prime covering some minterm.
     */
    BitSet essentialPrimes() {
        BitSet essential = new BitSet(rows.length);
        for (int column = 0; column < minterms.length; column++) {
            BitSet covering = coveringPrimes(column);
            if (covering.cardinality() == 1) {
                essential.set(covering.nextSetBit(0));
            }
        }
        return essential;
    }

    List<Implicant> cover(CoverStrategy strategy) {
        List<Integer> selection = new ArrayList<>();
        BitSet uncovered = new BitSet(minterms.length);
        uncovered.set(0, minterms.length);

        BitSet essential = essentialPrimes();
        for (int prime = essential.nextSetBit(0); prime >= 0; prime = essential.nextSetBit(prime + 1)) {
            selection.add(prime);
            uncovered.andNot(rows[prime]);
        }

        if (!uncovered.isEmpty()) {
            switch (strategy) {
                case GREEDY:
                    selection.addAll(greedyCover(uncovered));
                    break;
                case EXACT:
                    selection.addAll(exactCover(uncovered));
                    break;
                default:
                    throw new IllegalStateException("Unknown strategy " + strategy);
            }
        }

        List<Implicant> cover = new ArrayList<>(selection.size());
        for (int prime : selection) {
            cover.add(primes.get(prime));
        }
        return cover;
    }

    /**
     * Repeatedly picks the prime covering the most uncovered columns. Ties go to the prime with
     * fewer don't cares, then to the earlier prime.
     */
    List<Integer> greedyCover(BitSet uncovered) {
        BitSet remaining = BitSets.copyOf(uncovered);
        List<Integer> picked = new ArrayList<>();
        while (!remaining.isEmpty()) {
            int best = -1;
            int bestGain = 0;
            for (int prime = 0; prime < rows.length; prime++) {
                int gain = BitSets.intersectionSize(rows[prime], remaining);
                if (gain == 0) {
                    continue;
                }
                if (best == -1 || gain > bestGain || (gain == bestGain
                        && primes.get(prime).dontCareCount() < primes.get(best).dontCareCount())) {
                    best = prime;
                    bestGain = gain;
                }
            }
            // Every minterm is covered by some prime
            assert best >= 0;
            picked.add(best);
            remaining.andNot(rows[best]);
        }
        return picked;
    }

    /**
     * Finds a smallest set of primes covering the given columns. Among sets of equal size the one
     * with fewer literals wins, then the one whose sorted indices are lexicographically smaller.
     *
     * @return The indices of the selected primes in ascending order.
     */
    List<Integer> exactCover(BitSet uncovered) {
        Search search = new Search();
        List<Integer> greedy = greedyCover(uncovered);
        BitSet greedySelection = new BitSet(rows.length);
        greedy.forEach(greedySelection::set);
        search.offer(greedySelection);
        search.run(new BitSet(rows.length), BitSets.copyOf(uncovered));

        BitSet best = search.best;
        assert best != null;
        List<Integer> result = new ArrayList<>(best.cardinality());
        best.stream().forEach(result::add);
        return result;
    }

    private int literalCount(BitSet selection) {
        int literals = 0;
        for (int prime = selection.nextSetBit(0); prime >= 0; prime = selection.nextSetBit(prime + 1)) {
            literals += primes.get(prime).literalCount();
        }
        return literals;
    }

    private final class Search {
        @Nullable
        BitSet best;
        int bestSize = Integer.MAX_VALUE;
        int bestLiterals = Integer.MAX_VALUE;

        void run(BitSet selection, BitSet uncovered) {
            if (uncovered.isEmpty()) {
                offer(selection);
                return;
            }
            // At least one more prime is needed
            if (selection.cardinality() + 1 > bestSize) {
                return;
            }

            // Branch on the column with the fewest candidates
            int branchColumn = -1;
            BitSet branchCandidates = null;
            for (int column = uncovered.nextSetBit(0); column >= 0; column = uncovered.nextSetBit(column + 1)) {
                BitSet candidates = coveringPrimes(column);
                candidates.andNot(selection);
                if (branchCandidates == null || candidates.cardinality() < branchCandidates.cardinality()) {
                    branchColumn = column;
                    branchCandidates = candidates;
                }
            }
            assert branchColumn >= 0;

            for (int prime = branchCandidates.nextSetBit(0); prime >= 0;
                    prime = branchCandidates.nextSetBit(prime + 1)) {
                selection.set(prime);
                BitSet remaining = BitSets.copyOf(uncovered);
                remaining.andNot(rows[prime]);
                run(selection, remaining);
                selection.clear(prime);
            }
        }

        void offer(BitSet selection) {
            int size = selection.cardinality();
            int literals = literalCount(selection);
            if (best == null || size < bestSize
                    || (size == bestSize && (literals < bestLiterals
                    || (literals == bestLiterals && BitSets.lexicographicCompare(selection, best) < 0)))) {
                best = BitSets.copyOf(selection);
                bestSize = size;
                bestLiterals = literals;
            }
        }
    }
}
