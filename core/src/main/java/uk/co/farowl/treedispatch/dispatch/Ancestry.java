// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.dispatch;

import java.util.ArrayList;
import java.util.List;

import uk.co.farowl.treedispatch.node.Node;

/**
 * The ancestor chain of each kind of {@link Node}: the class itself,
 * its superclass, and so on up to and including {@code Node}, which
 * marks the end of every chain. The chain is the order in which a
 * {@link DispatchRegistry} looks for a handler, most specific first.
 * <p>
 * A Java class has exactly one superclass, so the chain is linear.
 * Interfaces a node class may implement take no part in it. Chains are
 * facts about classes, not about any registry, so they are computed
 * once per class and shared.
 */
public final class Ancestry {

    private Ancestry() {} // no instances and static members only

    /** Memoised chains keyed by node class. */
    private static final ClassValue<List<Class<? extends Node>>> CHAINS =
            new ClassValue<List<Class<? extends Node>>>() {

                @Override
                protected List<Class<? extends Node>>
                        computeValue(Class<?> c) {
                    return chain(c.asSubclass(Node.class));
                }
            };

    /**
     * The ancestor chain of the given kind of node, starting with
     * {@code type} itself and ending with {@code Node.class}.
     *
     * @param type of node
     * @return unmodifiable chain of classes, most specific first
     * @throws ClassCastException if {@code type} is not a {@code Node}
     *     (possible only through an unchecked cast)
     */
    public static List<Class<? extends Node>>
            of(Class<? extends Node> type) {
        return CHAINS.get(type);
    }

    private static List<Class<? extends Node>>
            chain(Class<? extends Node> type) {
        List<Class<? extends Node>> chain = new ArrayList<>();
        for (Class<?> c = type; c != Node.class; c = c.getSuperclass()) {
            chain.add(c.asSubclass(Node.class));
        }
        chain.add(Node.class);
        return List.copyOf(chain);
    }
}
