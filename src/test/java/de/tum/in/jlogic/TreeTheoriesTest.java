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
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import com.google.common.collect.Sets;
import de.tum.in.jlogic.MinimizerConfiguration.CoverStrategy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks evaluation and minimization invariants on generated trees.
 */
@SuppressWarnings({"checkstyle:javadoc", "NewClassNamingConvention"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class TreeTheoriesTest {
    private static final Logger logger = Logger.getLogger(TreeTheoriesTest.class.getName());

    private static final int treeCount = 150;
    private static final int variableCount = 5;
    private static final int treeDepth = 6;
    private static final List<Tree> trees = Generator.trees(0L, treeCount, variableCount, treeDepth);

    private static final MinimizerConfiguration exact =
            ImmutableMinimizerConfiguration.builder().coverStrategy(CoverStrategy.EXACT).build();
    private static final MinimizerConfiguration parallel =
            ImmutableMinimizerConfiguration.builder().parallel(true).build();

    private int constantCount = 0;

    public static Stream<Tree> trees() {
        return trees.stream();
    }

    private static void assertEquivalentOnTable(Tree tree, Tree simplified) {
        for (TruthTable.Row row : tree.truthTable().rows()) {
            assertThat(row.assignment().toString(), simplified.evaluate(row.assignment()), is(row.result()));
        }
    }

    @AfterAll
    public void statistics() {
        logger.log(Level.INFO, "{0} of {1} trees simplified to a constant",
                new Object[] {constantCount, treeCount});
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testTruthTable(Tree tree) {
        TruthTable table = tree.truthTable();
        int count = tree.variables().size();
        assertThat(table.size(), is(1 << count));

        Set<Map<String, Boolean>> assignments = Sets.newHashSet();
        for (TruthTable.Row row : table.rows()) {
            assertThat(row.assignment().keySet(), is(Set.copyOf(tree.variables())));
            assertThat(tree.evaluate(row.assignment()), is(row.result()));
            assignments.add(row.assignment());
        }
        assertThat(assignments.size(), is(table.size()));
        assertThat(tree.truthTable(parallel), is(table));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testSimplifySound(Tree tree) {
        Tree simplified = tree.simplify();
        assertEquivalentOnTable(tree, simplified);
        assertThat(simplified.variables(), is(tree.variables()));
        assertThat(simplified.truthTable(), is(tree.truthTable()));
        if (simplified.root().kind() == Node.Kind.CONSTANT) {
            constantCount += 1;
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testSimplifyForms(Tree tree) {
        for (NormalForm form : NormalForm.values()) {
            assertEquivalentOnTable(tree, tree.simplify(form));
            assertEquivalentOnTable(tree, tree.simplify(form, exact));
        }
        int sum = tree.simplify(NormalForm.SUM_OF_PRODUCTS).root().literalCount();
        int product = tree.simplify(NormalForm.PRODUCT_OF_SUMS).root().literalCount();
        assertThat(tree.simplify(NormalForm.SHORTEST).root().literalCount(), is(Math.min(sum, product)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testExactNotLarger(Tree tree) {
        TruthTable table = tree.truthTable();
        int count = table.variables().size();
        List<Implicant> greedyCover = new QuineMcCluskey().minimize(count, table.minterms());
        List<Implicant> exactCover = new QuineMcCluskey(exact).minimize(count, table.minterms());
        assertThat(exactCover.size(), lessThanOrEqualTo(greedyCover.size()));
        assertThat(tree.simplify(NormalForm.SUM_OF_PRODUCTS, exact).isEquivalentTo(tree.simplify()), is(true));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testIdempotent(Tree tree) {
        for (NormalForm form : NormalForm.values()) {
            Tree simplified = tree.simplify(form);
            assertThat(simplified.simplify(form).toString(), is(simplified.toString()));
            assertThat(simplified.simplify(form), is(simplified));

            Tree minimal = tree.simplify(form, exact);
            assertThat(minimal.simplify(form, exact).toString(), is(minimal.toString()));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testDeterministic(Tree tree) throws Exception {
        Tree copy = Tree.parse(tree.toString());
        assertThat(copy.simplify().toString(), is(tree.simplify().toString()));
        assertThat(tree.simplify(NormalForm.SUM_OF_PRODUCTS, parallel).toString(), is(tree.simplify().toString()));
        assertThat(Tree.load(ExpressionLoader.toDocument(tree.root())).simplify(), is(tree.simplify()));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testConstantDetection(Tree tree) {
        TruthTable table = tree.truthTable();
        Node root = tree.simplify().root();
        if (table.isTautology()) {
            assertThat(root, is(Constant.TRUE));
        } else if (table.isContradiction()) {
            assertThat(root, is(Constant.FALSE));
        } else {
            assertThat(root.kind() == Node.Kind.CONSTANT, is(false));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("trees")
    public void testEvaluationTotal(Tree tree) {
        Random random = new Random(tree.hashCode());
        for (int i = 0; i < 8; i++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (String name : tree.variables()) {
                assignment.put(name, random.nextBoolean());
            }
            tree.evaluate(assignment);
            assertThat(tree.root().negate().evaluate(assignment), is(!tree.evaluate(assignment)));
        }
    }
}
