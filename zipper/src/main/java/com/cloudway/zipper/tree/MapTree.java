/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper.tree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;

import com.cloudway.zipper.TreeOps;
import com.cloudway.zipper.Zipper;
import com.cloudway.zipper.data.Seq;

/**
 * Tree operations for trees made of nested maps.
 *
 * <p>The root of the tree is a {@link Node.Kind#MAP MAP} node holding the
 * whole map. Its children are {@link Node.Kind#ENTRY ENTRY} nodes, one per
 * key, in the iteration order of the map. An entry whose value is itself
 * a map is a branch whose children are the entries of that map.</p>
 *
 * <pre>{@code
 *     // {a=1, b={c=2, d=3}}  walks as  {a=1, b={c=2, d=3}}, a=1, b={c=2, d=3}, c=2, d=3
 * }</pre>
 *
 * <p>Rebuilt maps keep the order of the children. If two children share a
 * key, the value of the later one is kept at the position of the earlier
 * one.</p>
 *
 * <p>Maps are copied, at every level, when a node is built. Later changes
 * to the maps given by the caller are not seen by the tree.</p>
 */
public final class MapTree implements TreeOps<MapTree.Node> {
    private static final Logger logger = Logger.getLogger(MapTree.class.getName());

    public static final MapTree INSTANCE = new MapTree();

    private MapTree() {}

    /**
     * Returns a zipper focused on the root of the given map.
     */
    public static Zipper<Node> zipper(Map<?, ?> tree) {
        return Zipper.of(INSTANCE, Node.map(tree));
    }

    /**
     * A node of a map tree: either a whole map or a single key/value entry.
     */
    public static final class Node {
        public enum Kind { MAP, ENTRY }

        private final Kind kind;
        private final Object key;
        private final Object value;

        private Node(Kind kind, Object key, Object value) {
            this.kind = kind;
            this.key = key;
            this.value = Objects.requireNonNull(value);
        }

        public static Node map(Map<?, ?> map) {
            return new Node(Kind.MAP, null, freeze(Objects.requireNonNull(map)));
        }

        public static Node entry(Object key, Object value) {
            return new Node(Kind.ENTRY, Objects.requireNonNull(key), freeze(value));
        }

        // nested maps are copied at every level
        private static Object freeze(Object value) {
            if (!(value instanceof Map))
                return value;

            ImmutableMap.Builder<Object, Object> builder = ImmutableMap.builder();
            for (Map.Entry<?, ?> e : ((Map<?, ?>)value).entrySet()) {
                builder.put(e.getKey(), freeze(e.getValue()));
            }
            return builder.build();
        }

        public Kind kind() {
            return kind;
        }

        /**
         * Returns the key of an entry node.
         *
         * @throws IllegalStateException if this is a map node
         */
        public Object key() {
            if (kind != Kind.ENTRY)
                throw new IllegalStateException("a map node has no key");
            return key;
        }

        /**
         * Returns the map of a map node, or the value of an entry node.
         */
        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Node))
                return false;
            Node other = (Node)obj;
            return kind == other.kind
                && Objects.equals(key, other.key)
                && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, key, value);
        }

        @Override
        public String toString() {
            return kind == Kind.MAP ? value.toString() : key + "=" + value;
        }
    }

    @Override
    public boolean isBranch(Node node) {
        return node.kind == Node.Kind.MAP || node.value instanceof Map;
    }

    @Override
    public Seq<Node> children(Node node) {
        Seq<Node> res = Seq.nil();
        for (Map.Entry<?, ?> e : ((Map<?, ?>)node.value).entrySet()) {
            res = Seq.cons(new Node(Node.Kind.ENTRY, e.getKey(), e.getValue()), res);
        }
        return res.reverse();
    }

    @Override
    public Node makeNode(Node node, Seq<Node> children) {
        Map<Object, Object> map = new LinkedHashMap<>();
        for (Node child : children) {
            if (child.kind != Node.Kind.ENTRY)
                throw new IllegalArgumentException("a map can only contain entries: " + child);
            if (map.put(child.key, child.value) != null)
                logger.log(Level.FINE, "duplicate key {0} collapsed", child.key);
        }

        ImmutableMap<Object, Object> value = ImmutableMap.copyOf(map);
        return node.kind == Node.Kind.MAP ? new Node(Node.Kind.MAP, null, value)
                                          : new Node(Node.Kind.ENTRY, node.key, value);
    }

    @Override
    public String toString() {
        return "MapTree";
    }
}
