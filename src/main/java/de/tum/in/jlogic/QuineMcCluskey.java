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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Two-level minimization of a boolean function given by its minterms.
 *
 * <p>Minimization runs in three phases. First, implicants are grouped by their number of positive
 * literals and implicants of adjacent groups differing in one position are merged, level by level,
 * until no merge is possible; implicants never merged are prime. Second, a {@link
 * PrimeImplicantChart} records which prime covers which minterm. Third, essential primes are
 * selected and the remaining minterms are covered according to the configured {@link
 * MinimizerConfiguration.CoverStrategy}.</p>
 *
 * <p>All phases are deterministic: the same variable count and minterm set always yield the same
 * sequence of implicants, also when {@link MinimizerConfiguration#parallel()} is set.</p>
 */
public final class QuineMcCluskey {
    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private final MinimizerConfiguration configuration;

    public QuineMcCluskey() {
        this(MinimizerConfiguration.defaults());
    }

    public QuineMcCluskey(MinimizerConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration);
    }

    public MinimizerConfiguration configuration() {
        return configuration;
    }

    /**
     * Computes a cover of the given minterms by prime implicants.
     *
     * @param variableCount The number of variables of the function.
     * @param minterms The indices of the truth table rows where the function is true.
     * @return The selected implicants: essential primes in the order they were generated, followed
     *     by the primes chosen to cover the remaining minterms. Empty iff {@code minterms} is empty;
     *     the single universal implicant iff {@code minterms} contains every row.
     * @throws TooManyVariablesException If {@code variableCount} exceeds the configured limit.
     */
    public List<Implicant> minimize(int variableCount, BitSet minterms) {
        List<Implicant> primes = primeImplicants(variableCount, minterms);
        if (primes.isEmpty()) {
            return List.of();
        }
        PrimeImplicantChart chart = new PrimeImplicantChart(primes, minterms);
        List<Implicant> cover = chart.cover(configuration.coverStrategy());
        logger.log(Level.FINE, "Selected {0} of {1} prime implicants for {2} minterms: {3}",
                new Object[] {cover.size(), primes.size(), minterms.cardinality(), cover});
        return cover;
    }

    /**
     * Computes all prime implicants of the function with the given minterms, in the order they are
     * discovered: by level, and within a level by group and position.
     */
    public List<Implicant> primeImplicants(int variableCount, BitSet minterms) {
        if (variableCount < 0) {
            throw new IllegalArgumentException("Negative variable count " + variableCount);
        }
        configuration.checkVariableCount(variableCount);
        if (minterms.length() > (1 << variableCount)) {
            throw new IllegalArgumentException(String.format(
                    "Minterm %d out of range for %d variables", minterms.length() - 1, variableCount));
        }

        List<Implicant> level = minterms.stream()
                .mapToObj(minterm -> Implicant.ofMinterm(variableCount, minterm))
                .collect(Collectors.toList());
        Set<Implicant> primes = new LinkedHashSet<>();
        int depth = 0;
        while (!level.isEmpty()) {
            logger.log(Level.FINER, "Level {0}: {1} implicants", new Object[] {depth, level.size()});

            List<List<Implicant>> groups = groupByOnes(level, variableCount);
            Set<Implicant> merged = new HashSet<>();
            Set<Implicant> nextLevel = new LinkedHashSet<>();
            for (List<Implicant[]> merges : mergeAdjacentGroups(groups)) {
                for (Implicant[] merge : merges) {
                    merged.add(merge[0]);
                    merged.add(merge[1]);
                    nextLevel.add(merge[2]);
                }
            }
            for (Implicant implicant : level) {
                if (!merged.contains(implicant)) {
                    primes.add(implicant);
                }
            }
            for (Implicant implicant : nextLevel) {
                if (implicant.isUniversal()) {
                    // Only reachable when every row is a minterm, which makes this the sole prime
                    logger.log(Level.FINER, "Function is a tautology");
                    return List.of(implicant);
                }
            }
            level = new ArrayList<>(nextLevel);
            depth += 1;
        }
        logger.log(Level.FINER, "Found {0} prime implicants", primes.size());
        return List.copyOf(primes);
    }

    private static List<List<Implicant>> groupByOnes(List<Implicant> level, int variableCount) {
        List<List<Implicant>> groups = new ArrayList<>(variableCount + 1);
        for (int i = 0; i <= variableCount; i++) {
            groups.add(new ArrayList<>());
        }
        for (Implicant implicant : level) {
            groups.get(implicant.ones()).add(implicant);
        }
        return groups;
    }

    /**
     * Compares every pair of adjacent groups. The pairs are independent and may be processed in
     * parallel; the result lists keep the sequential order.
     */
    private List<List<Implicant[]>> mergeAdjacentGroups(List<List<Implicant>> groups) {
        IntStream pairs = IntStream.range(0, groups.size() - 1);
        if (configuration.parallel()) {
            pairs = pairs.parallel();
        }
        return pairs.mapToObj(index -> mergeGroups(groups.get(index), groups.get(index + 1)))
                .collect(Collectors.toList());
    }

    private static List<Implicant[]> mergeGroups(List<Implicant> lower, List<Implicant> upper) {
        List<Implicant[]> merges = new ArrayList<>();
        for (Implicant first : lower) {
            for (Implicant second : upper) {
                Implicant combined = first.combine(second);
                if (combined != null) {
                    merges.add(new Implicant[] {first, second, combined});
                }
            }
        }
        return merges;
    }
}
