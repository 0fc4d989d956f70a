/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import com.cloudway.zipper.data.Seq;

/**
 * A node that knows how to be navigated. Implemented by node types that
 * carry their own tree operations, so that differently shaped nodes can
 * coexist in one tree as long as they share the common supertype {@code N}.
 *
 * @param <N> the common node type
 * @see TreeOps#zipable()
 */
public interface Zipable<N extends Zipable<N>> {
    /**
     * Returns {@code true} if this node can have children.
     */
    boolean isBranch();

    /**
     * Returns the children of this node, in tree order.
     */
    Seq<N> children();

    /**
     * Returns a node like this one but with the given children.
     */
    N withChildren(Seq<N> children);
}
