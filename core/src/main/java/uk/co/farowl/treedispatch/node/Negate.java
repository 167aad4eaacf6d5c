// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** The arithmetic negative of its operand. */
public class Negate extends UnaryOperation {

    /**
     * Construct the negative of {@code operand}.
     *
     * @param operand to negate
     */
    public Negate(Node operand) { super(operand); }
}
