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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds pseudo-random expression trees from a seed, so that generated data is reproducible.
 */
public final class Generator {
    private static final Logger logger = Logger.getLogger(Generator.class.getName());
    private static final Operator[] OPERATORS = Operator.values();

    private Generator() {
        // empty
    }

    public static List<String> variables(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(String.valueOf((char) ('a' + i)));
        }
        return ImmutableList.copyOf(names);
    }

    public static List<Tree> trees(long seed, int count, int variableCount, int maxDepth) {
        logger.log(Level.FINE, "Generating {0} trees over {1} variables with depth at most {2}",
                new Object[] {count, variableCount, maxDepth});
        Random random = new Random(seed);
        List<String> names = variables(variableCount);
        List<Tree> trees = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            trees.add(Tree.of(node(random, names, 1 + random.nextInt(maxDepth))));
        }
        return ImmutableList.copyOf(trees);
    }

    public static Node node(Random random, List<String> names, int depth) {
        if (depth <= 1 || random.nextInt(4) == 0) {
            return new Variable(names.get(random.nextInt(names.size())), random.nextBoolean());
        }
        return new Expression(OPERATORS[random.nextInt(OPERATORS.length)],
                node(random, names, depth - 1), node(random, names, depth - 1), random.nextInt(3) == 0);
    }
}
