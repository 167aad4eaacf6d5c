// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** The difference of two operands. */
public class Subtract extends BinaryOperation {

    /**
     * Construct the difference of {@code left} and {@code right}.
     *
     * @param left operand
     * @param right operand
     */
    public Subtract(Node left, Node right) { super(left, right); }

    /**
     * Construct the difference of an array of operands, which must have
     * length two.
     *
     * @param operands of the operation
     * @throws NodeConstructionError if there are not exactly two
     */
    public Subtract(Node... operands) { super(operands); }
}
