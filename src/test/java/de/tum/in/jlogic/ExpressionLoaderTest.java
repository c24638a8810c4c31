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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import de.tum.in.jlogic.ExpressionLoader.SchemaException;
import java.util.EnumSet;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ExpressionLoaderTest {
    private static final Map<String, Object> nested = ImmutableMap.of(
            "operator", "or",
            "left", ImmutableMap.of(
                    "operator", "or",
                    "left", ImmutableMap.of("variable", "a"),
                    "right", ImmutableMap.of("variable", "b", "has_not", true)),
            "right", ImmutableMap.of("variable", "c", "has_not", true),
            "has_not", true);

    @Test
    public void testLoadNested() throws SchemaException {
        Node node = ExpressionLoader.load(nested);
        assertThat(node.toCanonicalString(), is("not((a or not(b)) or not(c))"));
        assertThat(node.toFunctionalString(), is("not(or(or(a, not(b)), not(c)))"));
    }

    @Test
    public void testLoadLeaves() throws SchemaException {
        assertThat(ExpressionLoader.load(ImmutableMap.of("variable", "a")), is(new Variable("a")));
        assertThat(ExpressionLoader.load(ImmutableMap.of("variable", "a", "has_not", false)),
                is(new Variable("a")));
        assertThat(ExpressionLoader.load(ImmutableMap.of("constant", true, "has_not", true)),
                is(Constant.FALSE));
    }

    @Test
    public void testOperatorNames() throws SchemaException {
        Node node = ExpressionLoader.load(ImmutableMap.of(
                "operator", "XNOR",
                "left", ImmutableMap.of("variable", "a"),
                "right", ImmutableMap.of("constant", false)));
        assertThat(node, is(new Expression(Operator.XNOR, new Variable("a"), Constant.FALSE)));
    }

    @Test
    public void testDocumentRoundTrip() throws SchemaException {
        assertThat(ExpressionLoader.toDocument(ExpressionLoader.load(nested)), is(nested));
        for (Tree tree : Generator.trees(11L, 100, 5, 6)) {
            assertThat(ExpressionLoader.load(ExpressionLoader.toDocument(tree.root())), is(tree.root()));
        }
    }

    @Test
    public void testDocumentForEveryKind() throws SchemaException {
        Map<Node.Kind, Node> samples = ImmutableMap.of(
                Node.Kind.VARIABLE, new Variable("a", true),
                Node.Kind.EXPRESSION, new Expression(Operator.NAND, new Variable("a"), Constant.TRUE, true),
                Node.Kind.CONSTANT, Constant.FALSE);
        assertThat(samples.keySet(), is(EnumSet.allOf(Node.Kind.class)));
        for (Map.Entry<Node.Kind, Node> entry : samples.entrySet()) {
            assertThat(entry.getValue().kind(), is(entry.getKey()));
            assertThat(ExpressionLoader.load(ExpressionLoader.toDocument(entry.getValue())), is(entry.getValue()));
        }
    }

    @Test
    public void testSchemaErrors() {
        SchemaException unknown = assertThrows(SchemaException.class, () -> ExpressionLoader.load(
                ImmutableMap.of("operator", "implies",
                        "left", ImmutableMap.of("variable", "a"),
                        "right", ImmutableMap.of("variable", "b"))));
        assertThat(unknown.path(), is("$"));

        SchemaException missing = assertThrows(SchemaException.class, () -> ExpressionLoader.load(
                ImmutableMap.of("operator", "and",
                        "left", ImmutableMap.of("operator", "or", "left", ImmutableMap.of("variable", "a")),
                        "right", ImmutableMap.of("variable", "b"))));
        assertThat(missing.path(), is("$.left"));

        SchemaException malformed = assertThrows(SchemaException.class, () -> ExpressionLoader.load(
                ImmutableMap.of("operator", "and",
                        "left", ImmutableMap.of("variable", "a"),
                        "right", "b")));
        assertThat(malformed.path(), is("$.right"));

        assertThrows(SchemaException.class,
                () -> ExpressionLoader.load(ImmutableMap.of("variable", "a", "has_not", "yes")));
        assertThrows(SchemaException.class,
                () -> ExpressionLoader.load(ImmutableMap.of("variable", "not")));
        assertThrows(SchemaException.class,
                () -> ExpressionLoader.load(ImmutableMap.of("variable", 1)));
        assertThrows(SchemaException.class,
                () -> ExpressionLoader.load(ImmutableMap.of("variable", "a", "constant", true)));
        assertThrows(SchemaException.class, () -> ExpressionLoader.load(ImmutableMap.of()));
    }
}
