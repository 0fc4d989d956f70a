/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.cloudway.zipper.TreeOps;
import com.cloudway.zipper.Zipper;
import com.cloudway.zipper.data.Seq;

/**
 * Tree operations for trees made of nested lists. Every {@link List} is a
 * branch whose children are its elements; every other value is a leaf.
 * Rebuilt branches are immutable lists, so leaves must not be {@code null}.
 *
 * <pre>{@code
 *     // [1, [2, [3, 4], 5], 6]  walks as  1, [2, [3, 4], 5], 2, [3, 4], 3, 4, 5, 6
 *     NestedLists.zipper(ImmutableList.of(1, ImmutableList.of(2, ImmutableList.of(3, 4), 5), 6))
 * }</pre>
 */
public final class NestedLists implements TreeOps<Object> {
    public static final NestedLists INSTANCE = new NestedLists();

    private NestedLists() {}

    /**
     * Returns a zipper focused on the given list.
     */
    public static Zipper<Object> zipper(List<?> tree) {
        return Zipper.of(INSTANCE, tree);
    }

    @Override
    public boolean isBranch(Object node) {
        return node instanceof List;
    }

    @Override
    public Seq<Object> children(Object node) {
        return Seq.wrap((List<?>)node);
    }

    @Override
    public Object makeNode(Object node, Seq<Object> children) {
        return ImmutableList.copyOf(children);
    }

    @Override
    public String toString() {
        return "NestedLists";
    }
}
