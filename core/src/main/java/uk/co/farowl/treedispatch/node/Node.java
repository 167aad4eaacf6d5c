// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.node;

import java.util.List;

/**
 * A {@code Node} is one term of an expression tree. The kind of a node
 * is its Java class, and the only thing a node knows about is its data:
 * what may be done with it (evaluate it, render it, and so on) is
 * decided elsewhere, by a dispatch registry keyed on that class.
 * <p>
 * Each kind has a fixed arity, the number of children it owns, checked
 * when the node is constructed. A child is owned by exactly one parent.
 * Since children must exist before their parent, a tree can contain no
 * cycles, and once constructed a node never changes.
 * <p>
 * A new kind of node is made by sub-classing either {@code Node} itself
 * or an existing kind. The sub-class inherits, for every behaviour, the
 * handler registered for its nearest ancestor, unless a handler is
 * registered for it specifically. A kind that constrains its children
 * (their kinds, say) should override {@link #checkChildren(List)}, so
 * that a rejected child is not left adopted by a node that was never
 * made.
 * <p>
 * Trees are walked by recursion, one Java stack frame (or a few) per
 * level, so a tree nested deeper than some thousands of levels will
 * end in {@code StackOverflowError}, here in {@link #toString()} as in
 * any behaviour.
 */
public abstract class Node {

    /** Children in order (unmodifiable). */
    private final List<Node> children;

    /**
     * Set when a parent adopts this node. This is bookkeeping for the
     * ownership check, not part of the value of the node, and is the
     * only state to change after construction. It is written during the
     * construction of the parent, which is where it must be read, so
     * trees should be built in one thread.
     */
    private boolean owned;

    /**
     * Construct a node that owns the given children, checking that
     * there are exactly as many as the kind requires.
     *
     * @param arity number of children this kind of node must have
     * @param children of the node, in order
     * @throws NodeConstructionError if the arity is wrong, a child is
     *     {@code null}, appears twice, already has a parent, or is
     *     rejected by {@link #checkChildren(List)}
     */
    protected Node(int arity, Node... children)
            throws NodeConstructionError {
        if (children == null) {
            throw new NodeConstructionError("%s children array is null",
                    kindName());
        } else if (children.length != arity) {
            throw new NodeConstructionError(
                    "%s takes exactly %d children (%d given)", kindName(),
                    arity, children.length);
        }
        for (int i = 0; i < arity; i++) {
            Node c = children[i];
            if (c == null) {
                throw new NodeConstructionError("%s child %d is null",
                        kindName(), i);
            } else if (c.owned) {
                throw new NodeConstructionError(
                        "%s child %d (%s) already belongs to another node",
                        kindName(), i, c.kindName());
            }
            for (int j = 0; j < i; j++) {
                if (children[j] == c) {
                    throw new NodeConstructionError(
                            "%s children %d and %d are the same node",
                            kindName(), j, i);
                }
            }
        }
        List<Node> list = List.of(children);
        checkChildren(list);
        // Only adopt once all are known to be adoptable.
        for (Node c : children) { c.owned = true; }
        this.children = list;
    }

    /**
     * Check constraints particular to this kind of node on its
     * children, before they are adopted. The default accepts any
     * children. An override should throw if the children are
     * unacceptable, and must use only its argument: it is called from
     * the {@code Node} constructor, before any field of the sub-class is
     * initialised.
     *
     * @param children proposed, of the right number and not null
     * @throws NodeConstructionError if the children are unacceptable
     */
    protected void checkChildren(List<Node> children)
            throws NodeConstructionError {}

    /**
     * The number of children this node owns.
     *
     * @return the arity of this kind of node
     */
    public final int arity() { return children.size(); }

    /**
     * The children of this node in order.
     *
     * @return unmodifiable list of children
     */
    public final List<Node> children() { return children; }

    /**
     * The child at the given position.
     *
     * @param index of the child
     * @return the child
     * @throws IndexOutOfBoundsException if there is no such child
     */
    public final Node child(int index) { return children.get(index); }

    /**
     * Whether this node has been adopted by a parent.
     *
     * @return {@code true} iff this node is the child of another
     */
    public final boolean isOwned() { return owned; }

    /**
     * Name of this kind of node, for messages.
     *
     * @return simple name of the implementing class
     */
    public final String kindName() { return getClass().getSimpleName(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kindName()).append('(');
        String sep = "";
        for (Node c : children) {
            sb.append(sep).append(c);
            sep = ", ";
        }
        return sb.append(')').toString();
    }
}
