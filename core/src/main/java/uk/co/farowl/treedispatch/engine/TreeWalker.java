// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import java.util.Objects;
import java.util.function.Function;

import uk.co.farowl.treedispatch.dispatch.DispatchError;
import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.dispatch.Handler;
import uk.co.farowl.treedispatch.node.Node;

/**
 * A recursive walk of a tree of {@link Node}s that applies one
 * behaviour, chosen per node from a {@link DispatchRegistry} by the class
 * of the node. Each handler is given this walk as the means to process
 * the children of its node, so a walk of a tree of {@code N} nodes
 * resolves and calls exactly {@code N} handlers. Nothing is cached
 * between walks.
 * <p>
 * A new behaviour needs only a new registry and handlers for it:
 * <pre>
 * DispatchRegistry&lt;Integer&gt; reg = new DispatchRegistry&lt;&gt;("depth");
 * reg.register(Literal.class, (n, depth) -&gt; 1);
 * ...
 * int d = new TreeWalker&lt;&gt;(reg).walk(tree);
 * </pre>
 * <p>
 * The walk recurses once per level of the tree (through the handler),
 * so the depth of tree it can handle is limited by the Java stack. A
 * tree too deep for it ends in {@code StackOverflowError}.
 *
 * @param <R> result type of the behaviour
 */
public class TreeWalker<R> {

    /** Registry from which handlers are chosen. */
    protected final DispatchRegistry<R> registry;

    /** The callback given to handlers (bound to {@link #walk(Node)}). */
    private final Function<Node, R> recurse = this::walk;

    /**
     * Create a walker that takes its handlers from the given registry.
     *
     * @param registry of handlers for this behaviour
     */
    public TreeWalker(DispatchRegistry<R> registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Apply the behaviour to the tree rooted at {@code node}.
     *
     * @param node root of the tree
     * @return result of the handler for {@code node}
     * @throws DispatchError if no handler is registered for the class of
     *     {@code node} (or of any node visited), or any of its ancestors
     */
    public R walk(Node node) throws DispatchError {
        Handler<Node, R> handler = registry.resolve(node.getClass());
        return handler.apply(node, recurse);
    }

    /** @return the registry from which handlers are chosen */
    public DispatchRegistry<R> registry() { return registry; }
}
