// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.samples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.treedispatch.dispatch.DispatchError;
import uk.co.farowl.treedispatch.dispatch.DispatchRegistry;
import uk.co.farowl.treedispatch.engine.Evaluator;
import uk.co.farowl.treedispatch.engine.Renderer;
import uk.co.farowl.treedispatch.engine.TreeWalker;
import uk.co.farowl.treedispatch.node.Add;
import uk.co.farowl.treedispatch.node.BinaryOperation;
import uk.co.farowl.treedispatch.node.FloatLiteral;
import uk.co.farowl.treedispatch.node.IntLiteral;
import uk.co.farowl.treedispatch.node.Literal;
import uk.co.farowl.treedispatch.node.Multiply;
import uk.co.farowl.treedispatch.node.Negate;
import uk.co.farowl.treedispatch.node.Node;
import uk.co.farowl.treedispatch.node.UnaryOperation;

/**
 * An application that embeds the library: it sets up the behaviours
 * once at start-up, freezes them, then evaluates and renders some
 * trees, logging what it finds.
 */
public class ExpressionDemo {

    /** Logger for the results. */
    static final Logger logger =
            LoggerFactory.getLogger(ExpressionDemo.class);

    final Evaluator evaluator;
    final Renderer renderer;
    /** A behaviour the library does not define: depth of the tree. */
    final TreeWalker<Integer> depth;

    /** Create the behaviours, then freeze their registries. */
    ExpressionDemo() {
        evaluator = Evaluator.standard();
        renderer = Renderer.standard();

        DispatchRegistry<Integer> depthRegistry =
                new DispatchRegistry<Integer>("depth")
                        .register(Literal.class, (n, d) -> 1)
                        .register(UnaryOperation.class,
                                (n, d) -> 1 + d.apply(n.operand()))
                        .register(BinaryOperation.class,
                                (n, d) -> 1 + Math.max(d.apply(n.left()),
                                        d.apply(n.right())));
        depth = new TreeWalker<>(depthRegistry);

        evaluator.registry().freeze();
        renderer.registry().freeze();
        depthRegistry.freeze();
    }

    /**
     * Log the text, value and depth of a tree.
     *
     * @param tree to describe
     */
    void describe(Node tree) {
        String text = renderer.render(tree);
        Number value = evaluator.evaluate(tree);
        int d = depth.walk(tree);
        logger.atInfo().setMessage("{} = {} (depth {})").addArgument(text)
                .addArgument(value).addArgument(d).log();
    }

    /**
     * Try to evaluate a tree containing a kind of node for which no
     * behaviour was ever registered. This fails, as it should.
     */
    void describeUnregistered() {
        Node tree = new Add(new IntLiteral(1), new Unregistered());
        try {
            describe(tree);
        } catch (DispatchError e) {
            logger.atWarn().setMessage("{}: {}").addArgument(tree)
                    .addArgument(e::getMessage).log();
        }
    }

    /** A kind of node no registry knows about. */
    static class Unregistered extends Node {
        Unregistered() { super(0); }
    }

    /**
     * Run the demonstration.
     *
     * @param args ignored
     */
    public static void main(String[] args) {
        ExpressionDemo demo = new ExpressionDemo();

        // @formatter:off
        demo.describe(new Multiply(
                new Add(new IntLiteral(3), new IntLiteral(5)),
                new Add(new IntLiteral(4), new IntLiteral(7))));
        demo.describe(new Multiply(
                new Add(new IntLiteral(2), new IntLiteral(3)),
                new IntLiteral(5)));
        demo.describe(new Negate(
                new Multiply(new FloatLiteral(1.5), new IntLiteral(4))));
        demo.describe(new Multiply(
                new IntLiteral(Long.MAX_VALUE), new IntLiteral(2)));
        demo.describe(new PositiveInteger(1234));
        // @formatter:on

        demo.describeUnregistered();
    }
}
