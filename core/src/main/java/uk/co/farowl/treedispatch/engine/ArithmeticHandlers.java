// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.node.Add;
import uk.co.farowl.treedispatch.node.Literal;
import uk.co.farowl.treedispatch.node.Multiply;
import uk.co.farowl.treedispatch.node.Negate;
import uk.co.farowl.treedispatch.node.Subtract;

/**
 * Evaluation handlers for the standard kinds of node, using the
 * operations in {@link Arithmetic}. A single handler serves all
 * {@link Literal}s, so a new kind of literal is evaluated without
 * further registration.
 */
public final class ArithmeticHandlers {

    private ArithmeticHandlers() {} // no instances

    /**
     * Register the standard evaluation handlers in a registry.
     *
     * @param registry to receive the handlers
     * @return {@code registry}
     */
    public static DispatchRegistry<Number>
            install(DispatchRegistry<Number> registry) {
        // @formatter:off
        return registry
            .register(Literal.class, (n, eval) -> n.value())
            .register(Add.class, (n, eval) ->
                    Arithmetic.add(eval.apply(n.left()), eval.apply(n.right())))
            .register(Subtract.class, (n, eval) ->
                    Arithmetic.subtract(eval.apply(n.left()), eval.apply(n.right())))
            .register(Multiply.class, (n, eval) ->
                    Arithmetic.multiply(eval.apply(n.left()), eval.apply(n.right())))
            .register(Negate.class, (n, eval) ->
                    Arithmetic.negate(eval.apply(n.operand())));
        // @formatter:on
    }
}
