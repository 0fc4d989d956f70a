/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import com.cloudway.zipper.Zipper;
import com.cloudway.zipper.tree.MapTree.Node;
import static com.cloudway.zipper.support.Matchers.*;

public class MapTreeTest
{
    private static final Map<String, Object> TREE =
        ImmutableMap.of("a", 1, "b", ImmutableMap.of("c", 2, "d", 3));

    private static Zipper<Node> at(String key) {
        return MapTree.zipper(TREE).find(z -> z.node().kind() == Node.Kind.ENTRY && key.equals(z.node().key())).get();
    }

    private static Map<?, ?> rootMap(Zipper<Node> z) {
        return (Map<?, ?>)z.root().value();
    }

    @Test
    public void walkInPreOrder() {
        List<String> nodes = MapTree.zipper(TREE).stream().map(Node::toString).collect(toList());
        assertEquals(Arrays.asList("{a=1, b={c=2, d=3}}", "a=1", "b={c=2, d=3}", "c=2", "d=3"), nodes);
    }

    @Test
    public void entriesWithMapValuesAreBranches() {
        assertTrue(MapTree.zipper(TREE).isBranch());
        assertFalse(at("a").isBranch());
        assertTrue(at("b").isBranch());
        assertEquals(2, at("d").depth());
    }

    @Test
    public void replaceADeepEntry() {
        Zipper<Node> z = at("c").replace(Node.entry("c", 20));
        assertEquals(ImmutableMap.of("a", 1, "b", ImmutableMap.of("c", 20, "d", 3)), rootMap(z));
        assertEquals(Node.Kind.MAP, z.root().kind());
    }

    @Test
    public void rebuiltMapsKeepTheOrder() {
        Zipper<Node> z = at("a").replace(Node.entry("z", 26));
        assertEquals(Arrays.asList("z", "b"), new ArrayList<>(rootMap(z).keySet()));
    }

    @Test
    public void duplicateKeysCollapse() {
        Zipper<Node> z = at("a").insertRight(Node.entry("a", 5));
        Map<?, ?> map = rootMap(z);
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(map.keySet()));
        assertEquals(5, map.get("a"));
    }

    @Test
    public void removeAnEntry() {
        Zipper<Node> removed = at("d").remove();
        assertEquals("c", removed.node().key());
        assertEquals(ImmutableMap.of("a", 1, "b", ImmutableMap.of("c", 2)), rootMap(removed));
    }

    @Test
    public void removeTheLastEntryLeavesAnEmptyMap() {
        Zipper<Node> removed = MapTree.zipper(ImmutableMap.of("x", ImmutableMap.of("y", 1)))
            .down().get().down().get().remove();

        assertEquals(Node.entry("x", ImmutableMap.of()), removed.node());
        assertTrue(removed.isBranch());
        assertThat(removed.down(), absent());
    }

    @Test
    public void appendChildTurnsAValueIntoAMap() {
        Zipper<Node> z = at("a").appendChild(Node.entry("z", 0));
        assertEquals(Node.entry("a", ImmutableMap.of("z", 0)), z.node());
        assertEquals("a={z=0}", z.node().toString());
    }

    @Test(expected = IllegalStateException.class)
    public void mapNodeHasNoKey() {
        MapTree.zipper(TREE).node().key();
    }

    @Test(expected = IllegalArgumentException.class)
    public void mapsContainOnlyEntries() {
        at("a").insertRight(Node.map(ImmutableMap.of())).root();
    }

    @Test
    public void nodesDoNotSeeLaterChangesToTheCallersMaps() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("c", 2);
        Map<String, Object> outer = new HashMap<>();
        outer.put("b", inner);

        Zipper<Node> z = MapTree.zipper(outer);
        Node entry = Node.entry("e", inner);
        inner.put("d", 3);
        outer.put("x", 0);

        List<String> nodes = z.stream().map(Node::toString).collect(toList());
        assertEquals(Arrays.asList("{b={c=2}}", "b={c=2}", "c=2"), nodes);
        assertEquals("e={c=2}", entry.toString());
        assertEquals(1, MapTree.INSTANCE.children(entry).count());
    }

    @Test(expected = NullPointerException.class)
    public void entriesNeedAValue() {
        Node.entry("a", null);
    }
}
