// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The node model: immutable trees of expression terms. Nodes hold data
 * only. Behaviour is attached to them by the registries in
 * {@code uk.co.farowl.treedispatch.dispatch}.
 */
package uk.co.farowl.treedispatch.node;
