// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.treedispatch.node.Node;

/**
 * Mapping from a kind of {@link Node} (its Java class) to the
 * {@link Handler} that implements one behaviour for it. There is one
 * registry per behaviour, e.g. one for evaluation and another for
 * rendering, and they are completely independent of each other.
 * <p>
 * A kind need not have a handler of its own. When asked to
 * {@link #resolve(Class) resolve} a class, the registry walks the
 * {@link Ancestry ancestor chain} of that class, most specific first,
 * and returns the first handler it finds. If there is none anywhere on
 * the chain, it throws a {@link DispatchError}: there is never a silent
 * default. {@code Node} itself ends every chain and may not be given a
 * handler.
 * <p>
 * The registry is intended to be filled during start-up, then
 * optionally {@link #freeze() frozen}, and only read after that.
 * Registration is synchronised on the registry and the handlers are
 * held in a concurrent map, so look-ups after the registration phase
 * are safe from any thread. Registration racing look-up is not
 * supported.
 *
 * @param <R> the result type of the behaviour
 */
public class DispatchRegistry<R> {

    /** Logger for registry changes. */
    static final Logger logger =
            LoggerFactory.getLogger(DispatchRegistry.class);

    /** Name of the behaviour this registry implements. */
    private final String name;

    /** The handler registered (exactly) for each class. */
    private final Map<Class<? extends Node>, Entry<?, R>> entries =
            new ConcurrentHashMap<>();

    /** When set, no further registration is allowed. */
    private volatile boolean frozen;

    /**
     * Create an empty registry for the named behaviour.
     *
     * @param name of the behaviour (used in messages)
     */
    public DispatchRegistry(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Register the handler for a kind of node, replacing any previous
     * registration for exactly that class. Sub-classes of {@code type}
     * with no handler of their own will resolve to this one.
     *
     * @param <N> kind of node
     * @param type class of the node kind
     * @param handler to apply to nodes of that class
     * @return {@code this}
     * @throws IllegalArgumentException if {@code type} is {@code Node}
     * @throws IllegalStateException if the registry is frozen
     */
    public synchronized <N extends Node> DispatchRegistry<R> register(
            Class<N> type, Handler<? super N, R> handler)
            throws IllegalArgumentException, IllegalStateException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (frozen) {
            throw new IllegalStateException(String.format(
                    "cannot register %s: %s registry is frozen",
                    type.getSimpleName(), name));
        } else if (type == Node.class) {
            throw new IllegalArgumentException(String.format(
                    "%s handler may not be registered for Node itself",
                    name));
        }

        Entry<?, R> previous = entries.put(type, new Entry<>(type, handler));

        logger.atDebug()
                .setMessage(previous == null ? "{} handler for {} registered"
                        : "{} handler for {} replaced")
                .addArgument(name).addArgument(type::getSimpleName).log();
        return this;
    }

    /**
     * Find the handler for a kind of node, being the one registered for
     * the class itself or, failing that, for the nearest class on its
     * ancestor chain. For a given state of the registry, the same
     * handler object is returned every time.
     *
     * @param type class of the node kind
     * @return the handler (accepting any node of class {@code type})
     * @throws DispatchError if no handler is registered on the chain
     */
    public Handler<Node, R> resolve(Class<? extends Node> type)
            throws DispatchError {
        return lookup(type);
    }

    /**
     * Find the class on the ancestor chain of {@code type} whose handler
     * {@link #resolve(Class)} would return.
     *
     * @param type class of the node kind
     * @return class for which the resolved handler was registered
     * @throws DispatchError if no handler is registered on the chain
     */
    public Class<? extends Node> resolvedType(Class<? extends Node> type)
            throws DispatchError {
        return lookup(type).type;
    }

    /**
     * Whether a handler is registered for exactly this class (ignoring
     * its ancestors).
     *
     * @param type class of the node kind
     * @return {@code true} iff registered for exactly {@code type}
     */
    public boolean isRegistered(Class<? extends Node> type) {
        return entries.containsKey(type);
    }

    /**
     * The classes for which a handler is registered exactly.
     *
     * @return unmodifiable snapshot of the registered classes
     */
    public Set<Class<? extends Node>> registeredTypes() {
        return Set.copyOf(entries.keySet());
    }

    /**
     * Prevent further registration. Look-ups are unaffected.
     *
     * @return {@code this}
     */
    public synchronized DispatchRegistry<R> freeze() {
        if (!frozen) {
            frozen = true;
            logger.atDebug().setMessage("{} registry frozen with {} handlers")
                    .addArgument(name).addArgument(entries::size).log();
        }
        return this;
    }

    /** @return {@code true} iff the registry has been frozen */
    public boolean isFrozen() { return frozen; }

    /** @return name of the behaviour this registry implements */
    public String name() { return name; }

    /**
     * Create a new, unfrozen registry with the same handlers as this
     * one. Later registrations in either do not affect the other.
     *
     * @param name of the behaviour the copy implements
     * @return the copy
     */
    public synchronized DispatchRegistry<R> copy(String name) {
        DispatchRegistry<R> copy = new DispatchRegistry<>(name);
        copy.entries.putAll(entries);
        return copy;
    }

    @Override
    public String toString() {
        return String.format("DispatchRegistry[%s: %d handlers]", name,
                entries.size());
    }

    private Entry<?, R> lookup(Class<? extends Node> type)
            throws DispatchError {
        Objects.requireNonNull(type, "type");
        for (Class<? extends Node> c : Ancestry.of(type)) {
            Entry<?, R> e = entries.get(c);
            if (e != null) { return e; }
        }
        throw new DispatchError(type, name);
    }

    /**
     * A registered handler together with the class it was registered
     * for. The entry is what {@link #resolve(Class)} hands out: it
     * narrows the node to the registered class before calling the
     * handler.
     *
     * @param <N> kind of node
     * @param <R> the result type of the behaviour
     */
    private static final class Entry<N extends Node, R>
            implements Handler<Node, R> {

        final Class<N> type;
        final Handler<? super N, R> handler;

        Entry(Class<N> type, Handler<? super N, R> handler) {
            this.type = type;
            this.handler = handler;
        }

        @Override
        public R apply(Node node, Function<Node, R> recurse) {
            return handler.apply(type.cast(node), recurse);
        }

        @Override
        public String toString() {
            return "Handler[" + type.getSimpleName() + "]";
        }
    }
}
