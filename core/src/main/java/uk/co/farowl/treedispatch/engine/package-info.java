// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Engines that walk a tree of nodes, applying one behaviour per walk.
 * {@link uk.co.farowl.treedispatch.engine.Evaluator} and
 * {@link uk.co.farowl.treedispatch.engine.Renderer} are the standard
 * behaviours. Each takes its handlers from its own registry.
 */
package uk.co.farowl.treedispatch.engine;
