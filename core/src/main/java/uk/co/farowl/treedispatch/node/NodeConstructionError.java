// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/**
 * Thrown when a {@link Node} cannot be constructed as requested: the
 * wrong number of children, a missing child, a child that already has
 * a parent, or a value the kind does not accept. These are detected
 * during construction so that any tree that exists is structurally
 * complete.
 */
public class NodeConstructionError extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public NodeConstructionError(String msg, Object... args) {
        super(String.format(msg, args));
    }
}
