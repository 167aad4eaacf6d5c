// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Type-directed dispatch: registries mapping each kind of node to the
 * handler of one behaviour, with fall-back along the ancestor chain.
 */
package uk.co.farowl.treedispatch.dispatch;
