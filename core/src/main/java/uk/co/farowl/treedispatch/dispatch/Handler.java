// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.dispatch;

import java.util.function.Function;

import uk.co.farowl.treedispatch.node.Node;

/**
 * The implementation of one behaviour for one kind of {@link Node}. A
 * handler receives the node and a callback with which to apply the same
 * behaviour to the node's children. Handlers must not modify the tree.
 *
 * @param <N> the kind of node handled
 * @param <R> the result of the behaviour
 */
@FunctionalInterface
public interface Handler<N extends Node, R> {

    /**
     * Apply the behaviour to {@code node}.
     *
     * @param node to which the behaviour applies
     * @param recurse applies the same behaviour to another node
     *     (normally a child of this one)
     * @return the result for {@code node}
     */
    R apply(N node, Function<Node, R> recurse);
}
