/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import com.cloudway.zipper.data.Seq;
import com.cloudway.zipper.support.TupleTree;
import static com.cloudway.zipper.support.Matchers.*;
import static com.cloudway.zipper.support.TupleTree.*;

public class ZipperWalkTest
{
    private static final Object TREE = T(1, 2, T(3, 4, 5));
    private static final Object DEEP = T(1, 11, T(12, 21, T(22, 31, T(32, 41, 42))), 13);

    @Test
    public void nextWalksInPreOrder() {
        Object tree = T(1, T(2, 3, 4), 5);
        Zipper<Object> z = zipper(tree);

        List<Object> visited = new ArrayList<>();
        while (!z.isEnd()) {
            visited.add(z.node());
            z = z.next();
        }

        assertEquals(Arrays.asList(tree, T(2, 3, 4), 3, 4, 5), visited);
        assertTrue(z.isTop());
        assertEquals(tree, z.node());
    }

    @Test
    public void nextIsIdempotentAtTheEnd() {
        Zipper<Object> ended = zipper(T(1, 2)).next().next();
        assertThat(ended, ended());
        assertSame(ended, ended.next());
        assertEquals(T(1, 2), ended.root());
        assertSame(ended, ended.top());
    }

    @Test
    public void singleLeafEndsImmediately() {
        Zipper<Object> ended = zipper(42).next();
        assertThat(ended, ended());
        assertEquals(42, ended.node());
    }

    @Test
    public void endedZipperCannotMove() {
        Zipper<Object> ended = zipper(TREE).next().next().next().next().next();
        assertThat(ended, ended());
        assertThat(ended.down(), absent());
        assertThat(ended.up(), absent());
        assertThat(ended.left(), absent());
        assertThat(ended.right(), absent());
    }

    @Test
    public void leavesInPreOrder() {
        Seq<Object> leaves = zipper(TREE).preorder().filter(n -> !OPS.isBranch(n));
        assertEquals(Seq.of(2, 4, 5), leaves);
        assertEquals(Seq.of(TREE, 2, T(3, 4, 5), 4, 5), zipper(TREE).preorder());
    }

    @Test
    public void prevUndoesNext() {
        Zipper<Object> z = zipper(DEEP);
        int steps = 0;
        for (Zipper<Object> next = z.next(); !next.isEnd(); z = next, next = z.next()) {
            assertEquals(z, next.prev().get());
            steps++;
        }
        assertEquals(9, steps);
    }

    @Test
    public void prevFromTheEndWalksBackwards() {
        Zipper<Object> z = zipper(DEEP);
        List<Object> forward = new ArrayList<>();
        while (!z.isEnd()) {
            forward.add(z.node());
            z = z.next();
        }

        List<Object> backward = new ArrayList<>();
        Optional<Zipper<Object>> p = Optional.of(z);
        for (int i = 0; i < forward.size(); i++) {
            p = p.get().prev();
            backward.add(p.get().node());
        }
        Collections.reverse(backward);

        assertEquals(forward, backward);
        assertTrue(p.get().isTop());
        assertThat(p.get().prev(), absent());
    }

    @Test
    public void prevFromTheEndIsTheLastNode() {
        Zipper<Object> ended = zipper(DEEP).traverse(z -> z);
        assertThat(ended, ended());
        assertThat(ended.prev().get(), focusedOn(13));
        assertFalse(ended.prev().get().isEnd());
        assertThat(zipper(DEEP).prev(), absent());
    }

    @Test
    public void prevDescendsIntoTheLeftSibling() {
        Zipper<Object> z = zipper(DEEP).down().get().right().get().right().get();
        assertThat(z, focusedOn(13));
        assertThat(z.prev().get(), focusedOn(42));
        assertEquals(4, z.prev().get().depth());
    }

    @Test
    public void findSearchesInPreOrder() {
        Zipper<Object> found = zipper(TREE).find(z -> valueOf(z.node()).equals(3)).get();
        assertThat(found, focusedOn(T(3, 4, 5)));
        assertEquals(1, found.depth());

        Zipper<Object> leaf = zipper(TREE).find(z -> !z.isBranch()).get();
        assertThat(leaf, focusedOn(2));

        assertThat(zipper(TREE).find(z -> valueOf(z.node()).equals(99)), absent());
        assertThat(zipper(TREE).traverse(z -> z).find(z -> true), absent());
    }

    @Test
    public void findStartsAtTheCurrentNode() {
        Zipper<Object> start = zipper(TREE).down().get().right().get();
        assertSame(start, start.find(z -> true).get());
        assertThat(start.find(z -> valueOf(z.node()).equals(2)), absent());
    }

    @Test
    public void streamOfNodes() {
        List<Object> values = zipper(TREE).stream().map(TupleTree::valueOf).collect(toList());
        assertEquals(Arrays.asList(1, 2, 3, 4, 5), values);
    }

    @Test
    public void preorderRunsToTheEndOfTheWholeWalk() {
        Zipper<Object> z = zipper(TREE).down().get();
        assertEquals(Seq.of(2, T(3, 4, 5), 4, 5), z.preorder());
        assertEquals(Seq.of(T(3, 4, 5), 4, 5), z.right().get().subtree().preorder());
        assertTrue(zipper(TREE).traverse(x -> x).preorder().isEmpty());
    }

    @Test
    public void preorderIsLazy() {
        AtomicInteger calls = new AtomicInteger();
        TreeOps<Object> counting = TreeOps.of(
            OPS::isBranch,
            n -> { calls.incrementAndGet(); return OPS.children(n); },
            OPS::makeNode);

        Seq<Object> nodes = Zipper.of(counting, TREE).preorder();
        assertEquals(TREE, nodes.head());
        assertEquals(0, calls.get());

        assertEquals(2, nodes.tail().head());
        assertEquals(1, calls.get());
    }
}
