/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper.data;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableList;

/**
 * A persistent, singly linked and potentially lazied list. Cells are never
 * mutated once constructed, so sequences can be freely shared between
 * zippers that are derived from each other.
 *
 * @param <T> the element type
 */
public interface Seq<T> extends Iterable<T>
{
    /**
     * Returns {@code true} if this list contains no elements.
     *
     * @return {@code true} if this list contains no elements
     */
    boolean isEmpty();

    /**
     * Returns the first element in the list.
     *
     * @return the first element in the list
     * @throws NoSuchElementException if the list is empty
     */
    T head();

    /**
     * Returns remaining elements in the list.
     *
     * @return remaining elements in the list
     * @throws NoSuchElementException if the list is empty
     */
    Seq<T> tail();

    /**
     * Peek the head element as an optional.
     *
     * @return {@code Optional.empty()} if the sequence is empty, otherwise
     * an optional wrapping the head value.
     */
    default Optional<T> peek() {
        return isEmpty() ? Optional.empty() : Optional.of(head());
    }

    // Constructors

    /**
     * Construct an empty list.
     *
     * @return the empty list
     */
    static <T> Seq<T> nil() {
        return SeqImpl.nil();
    }

    /**
     * Construct a list with head and tail.
     *
     * @param head the first element in the list
     * @param tail the remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * Construct a lazy list with head and a tail generator. The generator
     * is invoked at most once, when the tail is first requested.
     *
     * @param head the first element in the list
     * @param tail a supplier to generate remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    static <T> Seq<T> cons(T head, Supplier<Seq<T>> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * Construct a list with single element.
     */
    static <T> Seq<T> of(T value) {
        return SeqImpl.cons(value, SeqImpl.nil());
    }

    /**
     * Construct a list with given elements
     */
    @SafeVarargs
    static <T> Seq<T> of(T... elements) {
        Seq<T> res = nil();
        for (int i = elements.length; --i >= 0; ) {
            res = cons(elements[i], res);
        }
        return res;
    }

    /**
     * Copy the elements of an iterable into a strict list.
     */
    static <T> Seq<T> wrap(Iterable<? extends T> iterable) {
        if (iterable instanceof Seq) {
            @SuppressWarnings("unchecked")
            Seq<T> seq = (Seq<T>)iterable;
            return seq;
        }

        Seq<T> res = nil();
        for (T x : iterable) {
            res = cons(x, res);
        }
        return res.reverse();
    }

    // Operations

    /**
     * Reverse elements in this list.
     */
    default Seq<T> reverse() {
        Seq<T> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(xs.head(), res);
        }
        return res;
    }

    /**
     * Concatenate this list to other list. The cells of the other list are
     * shared, the cells of this list are copied.
     */
    default Seq<T> append(Seq<T> other) {
        if (other.isEmpty()) {
            return this;
        }

        Seq<T> res = other;
        for (Seq<T> xs = reverse(); !xs.isEmpty(); xs = xs.tail()) {
            res = cons(xs.head(), res);
        }
        return res;
    }

    /**
     * Append a single element at end of this sequence.
     */
    default Seq<T> append(T elem) {
        return append(of(elem));
    }

    /**
     * Prepend the elements of this list, in reverse order, onto the given
     * list. {@code xs.reverseOnto(ys)} is equivalent to
     * {@code xs.reverse().append(ys)} without the intermediate copy.
     */
    default Seq<T> reverseOnto(Seq<T> other) {
        Seq<T> res = other;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(xs.head(), res);
        }
        return res;
    }

    /**
     * Returns a list consisting of the results of applying the given function
     * to the elements of this list.
     *
     * @param <R> the element type of the new list
     * @param mapper a function to apply to each element
     * @return the new list
     */
    default <R> Seq<R> map(Function<? super T, ? extends R> mapper) {
        Seq<R> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(mapper.apply(xs.head()), res);
        }
        return res.reverse();
    }

    /**
     * Returns a list consisting of the elements of this list that match
     * the given predicate.
     */
    default Seq<T> filter(Predicate<? super T> predicate) {
        Seq<T> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            if (predicate.test(xs.head())) {
                res = cons(xs.head(), res);
            }
        }
        return res.reverse();
    }

    /**
     * Reduce the list using the binary operator, from left to right.
     */
    default <R> R foldLeft(R identity, BiFunction<R, ? super T, R> accumulator) {
        R result = identity;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            result = accumulator.apply(result, xs.head());
        }
        return result;
    }

    /**
     * Returns the last element of the list.
     *
     * @throws NoSuchElementException if the list is empty
     */
    default T last() {
        if (isEmpty()) {
            throw new NoSuchElementException();
        }

        Seq<T> xs = this;
        while (!xs.tail().isEmpty()) {
            xs = xs.tail();
        }
        return xs.head();
    }

    /**
     * Returns the count of elements in this list.
     *
     * @return the count of elements in this list
     */
    default int count() {
        int count = 0;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            count++;
        }
        return count;
    }

    /**
     * Returns an iterator over elements of this list.
     *
     * @return an iterator
     */
    @Override
    default Iterator<T> iterator() {
        return new Iterator<T>() {
            Seq<T> cur = Seq.this;

            @Override
            public boolean hasNext() {
                return !cur.isEmpty();
            }

            @Override
            public T next() {
                if (cur.isEmpty())
                    throw new NoSuchElementException();
                T res = cur.head();
                cur = cur.tail();
                return res;
            }
        };
    }

    /**
     * Performs an action for each element of this list.
     *
     * @param action an action to perform on the elements
     */
    @Override
    default void forEach(Consumer<? super T> action) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            action.accept(xs.head());
        }
    }

    /**
     * Returns a sequential stream over the elements of this list. Lazy cells
     * are forced only as the stream consumes them.
     */
    default Stream<T> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    /**
     * A convenient method that collect sequence elements into an immutable
     * list.
     */
    default List<T> toList() {
        return ImmutableList.copyOf(this);
    }
}
