// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/** An integer constant. */
public class IntLiteral extends Literal {

    private final long value;

    /**
     * Construct an integer literal.
     *
     * @param value of the literal
     */
    public IntLiteral(long value) { this.value = value; }

    @Override
    public Long value() { return value; }

    /**
     * The value as a primitive.
     *
     * @return value of the literal
     */
    public long longValue() { return value; }
}
