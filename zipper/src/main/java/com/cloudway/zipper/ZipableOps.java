/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import com.cloudway.zipper.data.Seq;

@SuppressWarnings({"rawtypes", "unchecked"})
final class ZipableOps implements TreeOps<Zipable> {
    static final ZipableOps INSTANCE = new ZipableOps();

    private ZipableOps() {}

    @Override
    public boolean isBranch(Zipable node) {
        return node.isBranch();
    }

    @Override
    public Seq<Zipable> children(Zipable node) {
        return node.children();
    }

    @Override
    public Zipable makeNode(Zipable node, Seq<Zipable> children) {
        return node.withChildren(children);
    }

    @Override
    public String toString() {
        return "TreeOps.zipable()";
    }
}
