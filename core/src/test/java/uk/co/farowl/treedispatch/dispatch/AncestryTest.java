// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.treedispatch.node.Add;
import uk.co.farowl.treedispatch.node.BinaryOperation;
import uk.co.farowl.treedispatch.node.FloatLiteral;
import uk.co.farowl.treedispatch.node.IntLiteral;
import uk.co.farowl.treedispatch.node.Literal;
import uk.co.farowl.treedispatch.node.Negate;
import uk.co.farowl.treedispatch.node.Node;
import uk.co.farowl.treedispatch.node.UnaryOperation;

/** Tests of the ancestor chains computed by {@link Ancestry}. */
@DisplayName("The ancestor chain")
class AncestryTest {

    /** Implementing an interface does not add to the chain. */
    interface Marker {}

    static class Leaf extends IntLiteral implements Marker {
        Leaf() { super(1); }
    }

    /**
     * Provide the standard kinds (and one local kind) with their
     * expected chains.
     *
     * @return parameter sets (class, chain, name for display)
     */
    static Stream<Arguments> chains() {
        return Stream.of( //
                chain(Node.class), //
                chain(IntLiteral.class, Literal.class, Node.class), //
                chain(FloatLiteral.class, Literal.class, Node.class), //
                chain(Add.class, BinaryOperation.class, Node.class), //
                chain(Negate.class, UnaryOperation.class, Node.class), //
                chain(Leaf.class, IntLiteral.class, Literal.class,
                        Node.class));
    }

    @SafeVarargs
    private static Arguments chain(Class<? extends Node>... expected) {
        return arguments(expected[0], List.of(expected),
                expected[0].getSimpleName());
    }

    @DisplayName("of each kind")
    @ParameterizedTest(name = "of {2}")
    @MethodSource("chains")
    void chainOf(Class<? extends Node> type,
            List<Class<? extends Node>> expected, String name) {
        assertEquals(expected, Ancestry.of(type));
    }

    @Test
    @DisplayName("is computed once per class")
    void memoised() {
        assertSame(Ancestry.of(Add.class), Ancestry.of(Add.class));
    }

    @Test
    @DisplayName("cannot be modified")
    void unmodifiable() {
        List<Class<? extends Node>> chain = Ancestry.of(Leaf.class);
        assertThrows(UnsupportedOperationException.class,
                () -> chain.add(Node.class));
    }
}
