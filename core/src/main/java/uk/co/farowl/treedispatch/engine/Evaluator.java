// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import uk.co.farowl.treedispatch.dispatch.DispatchError;
import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.node.Node;

/**
 * Computes the numeric value of an expression tree, dispatching each
 * node to the handler registered for its class in an evaluation
 * registry.
 */
public class Evaluator extends TreeWalker<Number> {

    /** Name of the registry {@link #standard()} creates. */
    public static final String BEHAVIOUR = "evaluate";

    /**
     * Create an evaluator using the given registry.
     *
     * @param registry of numeric handlers
     */
    public Evaluator(DispatchRegistry<Number> registry) {
        super(registry);
    }

    /**
     * Create an evaluator over a new registry holding the
     * {@link ArithmeticHandlers standard handlers}. The registry is not
     * frozen, so handlers for further kinds may be added.
     *
     * @return a new evaluator
     */
    public static Evaluator standard() {
        return new Evaluator(ArithmeticHandlers
                .install(new DispatchRegistry<>(BEHAVIOUR)));
    }

    /**
     * Compute the value of the tree rooted at {@code node}. Errors from
     * the handlers, including arithmetic ones, are not caught here.
     *
     * @param node root of the tree
     * @return the value
     * @throws DispatchError if a node has no evaluation handler
     */
    public Number evaluate(Node node) throws DispatchError {
        return walk(node);
    }
}
