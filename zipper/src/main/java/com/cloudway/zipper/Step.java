/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of visiting one node in {@link Zipper#traverseWhile}: the
 * (possibly edited) zipper, an accumulator, and how the walk goes on.
 *
 * @param <N> the node type
 * @param <A> the accumulator type
 */
public final class Step<N, A> {
    /**
     * How a walk proceeds after a visit.
     */
    public enum Action {
        /** Move to the next node in pre-order. */
        CONTINUE("cont"),
        /** Move past the current subtree without visiting its children. */
        SKIP("skip"),
        /** Stop the walk. */
        HALT("halt");

        private final String label;

        Action(String label) {
            this.label = label;
        }

        /**
         * Returns the short name of the action, as used by the factory
         * methods of {@link Step}.
         */
        public String label() {
            return label;
        }
    }

    private final Action action;
    private final Zipper<N> zipper;
    private final A acc;

    private Step(Action action, Zipper<N> zipper, A acc) {
        this.action = action;
        this.zipper = requireNonNull(zipper);
        this.acc = acc;
    }

    public static <N, A> Step<N, A> cont(Zipper<N> zipper, A acc) {
        return new Step<>(Action.CONTINUE, zipper, acc);
    }

    public static <N, A> Step<N, A> skip(Zipper<N> zipper, A acc) {
        return new Step<>(Action.SKIP, zipper, acc);
    }

    public static <N, A> Step<N, A> halt(Zipper<N> zipper, A acc) {
        return new Step<>(Action.HALT, zipper, acc);
    }

    public static <N> Step<N, Void> cont(Zipper<N> zipper) {
        return cont(zipper, null);
    }

    public static <N> Step<N, Void> skip(Zipper<N> zipper) {
        return skip(zipper, null);
    }

    public static <N> Step<N, Void> halt(Zipper<N> zipper) {
        return halt(zipper, null);
    }

    public Action action() {
        return action;
    }

    public Zipper<N> zipper() {
        return zipper;
    }

    public A acc() {
        return acc;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Step))
            return false;
        Step<?, ?> other = (Step<?, ?>)obj;
        return action == other.action
            && zipper.equals(other.zipper)
            && Objects.equals(acc, other.acc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, zipper, acc);
    }

    @Override
    public String toString() {
        return action.label() + "(" + zipper + (acc != null ? "," + acc : "") + ")";
    }
}
