// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.samples;

import uk.co.farowl.treedispatch.node.IntLiteral;
import uk.co.farowl.treedispatch.node.NodeConstructionError;

/**
 * An integer literal that must be greater than zero. It is a new kind
 * of node with no handlers of its own: evaluation and rendering find
 * those of {@link IntLiteral}.
 */
public class PositiveInteger extends IntLiteral {

    /**
     * Construct a positive integer literal.
     *
     * @param value of the literal
     * @throws NodeConstructionError if {@code value <= 0}
     */
    public PositiveInteger(long value) throws NodeConstructionError {
        super(check(value));
    }

    private static long check(long value) {
        if (value <= 0L) {
            throw new NodeConstructionError(
                    "PositiveInteger requires a value > 0 (%d given)",
                    value);
        }
        return value;
    }
}
