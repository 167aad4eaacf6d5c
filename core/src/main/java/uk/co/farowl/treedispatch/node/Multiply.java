// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** The product of two operands. */
public class Multiply extends BinaryOperation {

    /**
     * Construct the product of {@code left} and {@code right}.
     *
     * @param left operand
     * @param right operand
     */
    public Multiply(Node left, Node right) { super(left, right); }

    /**
     * Construct the product of an array of operands, which must have
     * length two.
     *
     * @param operands of the operation
     * @throws NodeConstructionError if there are not exactly two
     */
    public Multiply(Node... operands) { super(operands); }
}
