// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import java.util.function.Function;

import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.node.Add;
import uk.co.farowl.treedispatch.node.BinaryOperation;
import uk.co.farowl.treedispatch.node.FloatLiteral;
import uk.co.farowl.treedispatch.node.IntLiteral;
import uk.co.farowl.treedispatch.node.Multiply;
import uk.co.farowl.treedispatch.node.Negate;
import uk.co.farowl.treedispatch.node.Node;
import uk.co.farowl.treedispatch.node.Subtract;

/**
 * Rendering handlers for the standard kinds of node. Every operation
 * is enclosed in parentheses, whatever the precedence of the operators,
 * so that the text is unambiguous: {@code Multiply(Add(3, 5), 4)}
 * renders as {@code ((3 + 5) * 4)}.
 */
public final class InfixHandlers {

    private InfixHandlers() {} // no instances

    /**
     * Register the standard rendering handlers in a registry.
     *
     * @param registry to receive the handlers
     * @return {@code registry}
     */
    public static DispatchRegistry<String>
            install(DispatchRegistry<String> registry) {
        // @formatter:off
        return registry
            .register(IntLiteral.class, (n, r) -> Long.toString(n.longValue()))
            .register(FloatLiteral.class, (n, r) -> Double.toString(n.doubleValue()))
            .register(Add.class, (n, r) -> binary(n, "+", r))
            .register(Subtract.class, (n, r) -> binary(n, "-", r))
            .register(Multiply.class, (n, r) -> binary(n, "*", r))
            .register(Negate.class, (n, r) -> "(-" + r.apply(n.operand()) + ")");
        // @formatter:on
    }

    /**
     * Render a binary operation as {@code (<left> <op> <right>)}.
     *
     * @param n the operation
     * @param op symbol for the operator
     * @param render applied to the operands
     * @return text of the operation
     */
    static String binary(BinaryOperation n, String op,
            Function<Node, String> render) {
        return "(" + render.apply(n.left()) + " " + op + " "
                + render.apply(n.right()) + ")";
    }
}
