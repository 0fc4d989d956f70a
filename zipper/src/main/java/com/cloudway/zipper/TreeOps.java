/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import com.cloudway.zipper.data.Seq;
import static java.util.Objects.requireNonNull;

/**
 * The operations a tree shape must supply to be navigated by a {@link Zipper}.
 * A zipper never inspects a node directly, it only asks its {@code TreeOps}.
 *
 * <p>Implementations must be pure and reentrant: the same node must always
 * give the same answer, and no node may be mutated.</p>
 *
 * @param <N> the node type
 */
public interface TreeOps<N> {
    /**
     * Returns {@code true} if the given node can have children.
     */
    boolean isBranch(N node);

    /**
     * Returns the children of the given branch node, in tree order. Only
     * called when {@link #isBranch(Object)} holds for the node.
     */
    Seq<N> children(N node);

    /**
     * Creates a node of the same kind as the given node, with the given
     * children. The node may be a leaf that is being promoted to a branch.
     */
    N makeNode(N node, Seq<N> children);

    /**
     * Assemble tree operations from three functions.
     */
    static <N> TreeOps<N> of(Predicate<? super N> isBranch,
                             Function<? super N, Seq<N>> children,
                             BiFunction<? super N, Seq<N>, ? extends N> makeNode) {
        requireNonNull(isBranch);
        requireNonNull(children);
        requireNonNull(makeNode);

        return new TreeOps<N>() {
            @Override
            public boolean isBranch(N node) {
                return isBranch.test(node);
            }

            @Override
            public Seq<N> children(N node) {
                return children.apply(node);
            }

            @Override
            public N makeNode(N node, Seq<N> xs) {
                return makeNode.apply(node, xs);
            }
        };
    }

    /**
     * Returns the tree operations that dispatch to the nodes themselves.
     */
    @SuppressWarnings("unchecked")
    static <N extends Zipable<N>> TreeOps<N> zipable() {
        return (TreeOps<N>)(TreeOps<?>)ZipableOps.INSTANCE;
    }
}
