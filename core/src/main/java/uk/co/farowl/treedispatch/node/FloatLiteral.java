// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** A floating-point constant. */
public class FloatLiteral extends Literal {

    private final double value;

    /**
     * Construct a floating-point literal.
     *
     * @param value of the literal
     */
    public FloatLiteral(double value) { this.value = value; }

    @Override
    public Double value() { return value; }

    /**
     * The value as a primitive.
     *
     * @return value of the literal
     */
    public double doubleValue() { return value; }
}
