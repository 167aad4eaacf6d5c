// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.treedispatch.dispatch.DispatchError;
import uk.co.farowl.treedispatch.node.Add;
import uk.co.farowl.treedispatch.node.BinaryOperation;
import uk.co.farowl.treedispatch.node.IntLiteral;
import uk.co.farowl.treedispatch.node.Multiply;
import uk.co.farowl.treedispatch.node.Node;
import uk.co.farowl.treedispatch.node.NodeConstructionError;

/**
 * Tests that new kinds of node, defined here and not known to the
 * library, work with the standard behaviours without any change to the
 * existing kinds, handlers or registries.
 */
@DisplayName("A new kind of node")
class ExtensionTest {

    /** An integer that must be positive: no handlers of its own. */
    static class PositiveInteger extends IntLiteral {
        PositiveInteger(long value) {
            super(value);
            if (value <= 0L) {
                throw new NodeConstructionError("%d is not positive",
                        value);
            }
        }
    }

    /** A further step down the chain. */
    static class Digit extends PositiveInteger {
        Digit(int value) { super(value); }
    }

    /** A fresh root: a named variable. */
    static class Variable extends Node {
        final String name;

        Variable(String name) {
            super(0);
            this.name = name;
        }
    }

    /** An operation with no handlers anywhere on its chain. */
    static class Modulo extends BinaryOperation {
        Modulo(Node left, Node right) { super(left, right); }
    }

    Evaluator evaluator;
    Renderer renderer;
    Set<Class<? extends Node>> standardEvaluate;
    Set<Class<? extends Node>> standardRender;

    @BeforeEach
    void setUp() {
        evaluator = Evaluator.standard();
        renderer = Renderer.standard();
        standardEvaluate = evaluator.registry().registeredTypes();
        standardRender = renderer.registry().registeredTypes();
    }

    @Nested
    @DisplayName("derived from IntLiteral, with no registration")
    class InheritedTest {

        @Test
        @DisplayName("renders and evaluates as an IntLiteral")
        void positiveInteger() {
            assertEquals("1234", renderer.render(new PositiveInteger(1234)));
            assertEquals(1234L,
                    evaluator.evaluate(new PositiveInteger(1234)));
        }

        @Test
        @DisplayName("behaves as an equal IntLiteral would")
        void sameAsBase() {
            assertEquals(renderer.render(new IntLiteral(77)),
                    renderer.render(new PositiveInteger(77)));
            assertEquals(evaluator.evaluate(new IntLiteral(77)),
                    evaluator.evaluate(new PositiveInteger(77)));
        }

        @Test
        @DisplayName("works inside trees of standard kinds")
        void inTree() {
            Node tree = new Multiply(
                    new Add(new PositiveInteger(3), new Digit(5)),
                    new Add(new IntLiteral(4), new Digit(7)));
            assertEquals("((3 + 5) * (4 + 7))", renderer.render(tree));
            assertEquals(88L, evaluator.evaluate(tree));
        }

        @Test
        @DisplayName("needed no change to the registries")
        void registriesUnchanged() {
            evaluator.evaluate(new Digit(9));
            renderer.render(new Digit(9));
            assertEquals(standardEvaluate,
                    evaluator.registry().registeredTypes());
            assertEquals(standardRender,
                    renderer.registry().registeredTypes());
            assertFalse(evaluator.registry().isRegistered(Digit.class));
        }

        @Test
        @DisplayName("still checks its own constraint at construction")
        void constraint() {
            assertThrows(NodeConstructionError.class,
                    () -> new PositiveInteger(0));
        }
    }

    @Nested
    @DisplayName("given a handler in one registry only")
    class SpecialisedTest {

        @BeforeEach
        void register() {
            renderer.registry().register(PositiveInteger.class,
                    (n, r) -> "+" + n.longValue());
        }

        @Test
        @DisplayName("uses it in that behaviour alone")
        void renderOnly() {
            Node tree = new Add(new PositiveInteger(2), new Digit(3));
            assertEquals("(+2 + +3)", renderer.render(tree));
            assertEquals(5L, evaluator.evaluate(tree));
            assertEquals(IntLiteral.class,
                    evaluator.registry().resolvedType(Digit.class));
        }

        @Test
        @DisplayName("does not change how the base kind is treated")
        void baseUnchanged() {
            assertEquals("6", renderer.render(new IntLiteral(6)));
        }
    }

    @Nested
    @DisplayName("with a fresh root")
    class FreshRootTest {

        final Map<String, Number> values = Map.of("x", 41L, "y", 0.5);

        @Test
        @DisplayName("fails until a handler is registered")
        void unregistered() {
            Node tree = new Add(new Variable("x"), new IntLiteral(1));
            DispatchError e = assertThrows(DispatchError.class,
                    () -> evaluator.evaluate(tree));
            assertEquals(Variable.class, e.getType());
            assertThrows(DispatchError.class, () -> renderer.render(tree));
        }

        @Test
        @DisplayName("works once registered")
        void registered() {
            evaluator.registry().register(Variable.class,
                    (n, eval) -> values.get(n.name));
            renderer.registry().register(Variable.class,
                    (n, r) -> n.name);
            Node tree = new Add(new Variable("x"), new IntLiteral(1));
            assertEquals(42L, evaluator.evaluate(tree));
            assertEquals("(x + 1)", renderer.render(tree));

            Node other = new Multiply(new Variable("y"), new Variable("x"));
            assertEquals(20.5, evaluator.evaluate(other));
            assertEquals("(y * x)", renderer.render(other));
        }
    }

    @Test
    @DisplayName("fails if no ancestor has a handler")
    void noAncestorHandler() {
        Node tree = new Modulo(new IntLiteral(7), new IntLiteral(3));
        DispatchError e = assertThrows(DispatchError.class,
                () -> evaluator.evaluate(tree));
        assertEquals("no evaluate handler for Modulo", e.getMessage());
        e = assertThrows(DispatchError.class, () -> renderer.render(tree));
        assertEquals("no render handler for Modulo", e.getMessage());
    }
}
