// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

/**
 * Base of leaf nodes that stand for a constant. A literal has no
 * children, so it is where a recursive walk of the tree stops.
 */
public abstract class Literal extends Node {

    /** Construct a literal (which has no children). */
    protected Literal() { super(0); }

    /**
     * The constant this literal represents.
     *
     * @return value of the literal
     */
    public abstract Number value();

    @Override
    public String toString() { return kindName() + "(" + value() + ")"; }
}
