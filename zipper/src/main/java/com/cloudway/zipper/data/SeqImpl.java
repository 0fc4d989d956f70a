/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Supplier;
import static java.util.Objects.requireNonNull;

final class SeqImpl {
    private SeqImpl() {}

    @SuppressWarnings("rawtypes")
    private static final Seq NIL = new Seq() {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Object head() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq tail() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq reverse() {
            return this;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Seq && ((Seq)obj).isEmpty();
        }

        @Override
        public int hashCode() {
            return 1;
        }

        @Override
        public String toString() {
            return "[]";
        }
    };

    private static abstract class Cell<T> implements Seq<T> {
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof Seq && SeqImpl.equals(this, (Seq<?>)obj));
        }

        @Override
        public int hashCode() {
            return SeqImpl.hashCode(this);
        }

        @Override
        public String toString() {
            return SeqImpl.toString(this);
        }
    }

    private static final class Cons<T> extends Cell<T> {
        private final T head;
        private final Seq<T> tail;

        Cons(T head, Seq<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            return tail;
        }
    }

    private static final class LazySeq<T> extends Cell<T> {
        private final T head;
        private volatile Supplier<Seq<T>> generator;
        private volatile Seq<T> tail;

        LazySeq(T head, Supplier<Seq<T>> generator) {
            this.head = head;
            this.generator = generator;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            if (tail == null)
                expand();
            return tail;
        }

        private synchronized void expand() {
            if (tail == null) {
                tail = requireNonNull(generator.get());
                generator = null; // no longer used again
            }
        }

        boolean computed() {
            return generator == null;
        }
    }

    @SuppressWarnings("unchecked")
    static <T> Seq<T> nil() {
        return (Seq<T>)NIL;
    }

    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return new Cons<>(head, requireNonNull(tail));
    }

    static <T> Seq<T> cons(T head, Supplier<Seq<T>> generator) {
        return new LazySeq<>(head, requireNonNull(generator));
    }

    static boolean equals(Seq<?> xs, Seq<?> ys) {
        while (!xs.isEmpty() && !ys.isEmpty()) {
            if (!Objects.equals(xs.head(), ys.head()))
                return false;
            xs = xs.tail();
            ys = ys.tail();
        }
        return xs.isEmpty() && ys.isEmpty();
    }

    static int hashCode(Seq<?> xs) {
        int hash = 1;
        for (; !xs.isEmpty(); xs = xs.tail()) {
            hash = 31 * hash + Objects.hashCode(xs.head());
        }
        return hash;
    }

    static <T> String toString(Seq<T> xs) {
        StringJoiner sj = new StringJoiner(", ", "[", "]");
        while (true) {
            if (xs.isEmpty()) {
                break;
            }
            sj.add(String.valueOf(xs.head()));
            if ((xs instanceof LazySeq) && !((LazySeq<T>)xs).computed()) {
                sj.add("?");
                break;
            }
            xs = xs.tail();
        }
        return sj.toString();
    }
}
