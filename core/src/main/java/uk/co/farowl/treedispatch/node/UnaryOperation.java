// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** Base of nodes that apply an operation to one operand. */
public abstract class UnaryOperation extends Node {

    /**
     * Construct a unary operation.
     *
     * @param operand of the operation
     * @throws NodeConstructionError if the operand is missing or already
     *     has a parent
     */
    protected UnaryOperation(Node operand) throws NodeConstructionError {
        super(1, operand);
    }

    /** @return the operand */
    public final Node operand() { return child(0); }
}
