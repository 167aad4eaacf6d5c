// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import uk.co.farowl.treedispatch.dispatch.DispatchError;
import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.node.Node;

/**
 * Produces the text of an expression tree, dispatching each node to
 * the handler registered for its class in a rendering registry. The
 * rendering registry is separate from any used for evaluation.
 */
public class Renderer extends TreeWalker<String> {

    /** Name of the registry {@link #standard()} creates. */
    public static final String BEHAVIOUR = "render";

    /**
     * Create a renderer using the given registry.
     *
     * @param registry of text-producing handlers
     */
    public Renderer(DispatchRegistry<String> registry) {
        super(registry);
    }

    /**
     * Create a renderer over a new registry holding the
     * {@link InfixHandlers standard handlers}. The registry is not
     * frozen, so handlers for further kinds may be added.
     *
     * @return a new renderer
     */
    public static Renderer standard() {
        return new Renderer(
                InfixHandlers.install(new DispatchRegistry<>(BEHAVIOUR)));
    }

    /**
     * Produce the text of the tree rooted at {@code node}.
     *
     * @param node root of the tree
     * @return the text
     * @throws DispatchError if a node has no rendering handler
     */
    public String render(Node node) throws DispatchError {
        return walk(node);
    }
}
