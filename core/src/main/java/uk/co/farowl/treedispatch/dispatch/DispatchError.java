// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.dispatch;

import uk.co.farowl.treedispatch.node.Node;

/**
 * Thrown when a {@link DispatchRegistry} holds no handler for a kind of
 * {@link Node}, nor for any of its ancestors. This signals a programming
 * error (a behaviour was never registered) rather than a condition from
 * which the caller should try to recover.
 */
public class DispatchError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The class for which no handler was found. */
    private final Class<? extends Node> type;

    /** Name of the behaviour (registry) consulted. */
    private final String behaviour;

    /**
     * Constructor specifying the kind and behaviour that failed.
     *
     * @param type for which no handler was found
     * @param behaviour name of the registry consulted
     */
    public DispatchError(Class<? extends Node> type, String behaviour) {
        super(String.format("no %s handler for %s", behaviour,
                type.getSimpleName()));
        this.type = type;
        this.behaviour = behaviour;
    }

    /** @return the class for which no handler was found */
    public Class<? extends Node> getType() { return type; }

    /** @return name of the behaviour consulted */
    public String getBehaviour() { return behaviour; }
}
