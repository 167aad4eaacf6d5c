// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/**
 * Base of nodes that combine exactly two operands. A handler
 * registered for {@code BinaryOperation} serves every sub-class that
 * has no handler of its own.
 */
public abstract class BinaryOperation extends Node {

    /**
     * Construct a binary operation on two operands.
     *
     * @param left operand
     * @param right operand
     * @throws NodeConstructionError if an operand is missing or already
     *     has a parent
     */
    protected BinaryOperation(Node left, Node right)
            throws NodeConstructionError {
        super(2, left, right);
    }

    /**
     * Construct a binary operation from an array of operands, which
     * must have length two. This is for callers building nodes from a
     * list of children of variable length.
     *
     * @param operands of the operation
     * @throws NodeConstructionError if there are not exactly two
     *     operands, or one is missing or already has a parent
     */
    protected BinaryOperation(Node... operands)
            throws NodeConstructionError {
        super(2, operands);
    }

    /** @return the left operand */
    public final Node left() { return child(0); }

    /** @return the right operand */
    public final Node right() { return child(1); }
}
