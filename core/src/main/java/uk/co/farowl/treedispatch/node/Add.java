// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** The sum of two operands. */
public class Add extends BinaryOperation {

    /**
     * Construct the sum of {@code left} and {@code right}.
     *
     * @param left operand
     * @param right operand
     */
    public Add(Node left, Node right) { super(left, right); }

    /**
     * Construct the sum of an array of operands, which must have
     * length two.
     *
     * @param operands of the operation
     * @throws NodeConstructionError if there are not exactly two
     */
    public Add(Node... operands) { super(operands); }
}
