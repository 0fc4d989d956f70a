/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.cloudway.zipper.data.Seq;
import com.cloudway.zipper.data.Tuple;
import static java.util.Objects.requireNonNull;

/**
 * An immutable tree zipper: a focus on one node of a tree, together with
 * the context needed to move to any neighbouring node and to rebuild the
 * whole tree, edits included.
 *
 * <p>A zipper never inspects nodes itself. The shape of the tree is given
 * by the {@link TreeOps} supplied when the zipper is created, and every
 * derived zipper carries the same operations.</p>
 *
 * <p>Moves that have no target (going {@link #up()} from the top, past the
 * last sibling, or {@link #down()} into a leaf) return an empty
 * {@code Optional}. Edits that have no meaning at the top of the tree throw
 * {@link ZipperException}. No operation modifies an existing zipper.</p>
 *
 * <p>The depth-first walk {@link #next()} ends on a top-level zipper for
 * which {@link #isEnd()} returns {@code true}. Such a zipper can only be
 * walked backwards with {@link #prev()}, or restarted by one of the
 * traversal methods.</p>
 *
 * @param <N> the node type
 */
public final class Zipper<N> {
    private static final Logger logger = Logger.getLogger(Zipper.class.getName());

    private final TreeOps<N> ops;
    private final N loc;
    private final Seq<N> left;      // nearest sibling first
    private final Seq<N> right;
    private final Zipper<N> parent; // null at the top
    private final boolean end;

    private Zipper(TreeOps<N> ops, N loc, Seq<N> left, Seq<N> right, Zipper<N> parent, boolean end) {
        this.ops = ops;
        this.loc = loc;
        this.left = left;
        this.right = right;
        this.parent = parent;
        this.end = end;
    }

    /**
     * Returns a zipper focused on the root of the given tree.
     *
     * @param ops the operations that describe the shape of the tree
     * @param tree the root node
     */
    public static <N> Zipper<N> of(TreeOps<N> ops, N tree) {
        return new Zipper<>(requireNonNull(ops), tree, Seq.nil(), Seq.nil(), null, false);
    }

    /**
     * Returns a zipper focused on the root of a tree whose nodes describe
     * their own shape.
     */
    public static <N extends Zipable<N>> Zipper<N> of(N tree) {
        return of(TreeOps.zipable(), tree);
    }

    /**
     * Returns a zipper that treats the current node as the root of a tree
     * of its own. The siblings, the parents and the end marker of this
     * zipper are not carried over.
     */
    public Zipper<N> subtree() {
        return parent == null && !end ? this : fresh(loc);
    }

    private Zipper<N> fresh(N node) {
        return new Zipper<>(ops, node, Seq.nil(), Seq.nil(), null, false);
    }

    private Zipper<N> withLoc(N node) {
        return new Zipper<>(ops, node, left, right, parent, end);
    }

    // Accessors

    /**
     * Returns the node in focus.
     */
    public N node() {
        return loc;
    }

    /**
     * Returns the tree operations carried by this zipper.
     */
    public TreeOps<N> ops() {
        return ops;
    }

    /**
     * Returns {@code true} if the depth-first walk has been exhausted.
     */
    public boolean isEnd() {
        return end;
    }

    /**
     * Returns {@code true} if the node in focus has no parent.
     */
    public boolean isTop() {
        return parent == null;
    }

    /**
     * Returns {@code true} if the node in focus is a branch.
     */
    public boolean isBranch() {
        return ops.isBranch(loc);
    }

    /**
     * Returns the children of the node in focus.
     *
     * @throws IllegalStateException if the node in focus is not a branch
     */
    public Seq<N> children() {
        if (!ops.isBranch(loc))
            throw new IllegalStateException("called children on a leaf node");
        return ops.children(loc);
    }

    /**
     * Creates a node like the node in focus, with the given children. The
     * zipper itself is not changed.
     */
    public N makeNode(Seq<N> children) {
        return ops.makeNode(loc, children);
    }

    /**
     * Returns the siblings before the node in focus, in tree order.
     */
    public Seq<N> lefts() {
        return left.reverse();
    }

    /**
     * Returns the siblings after the node in focus, in tree order.
     */
    public Seq<N> rights() {
        return right;
    }

    /**
     * Returns the number of parents above the node in focus.
     */
    public int depth() {
        int depth = 0;
        for (Zipper<N> z = parent; z != null; z = z.parent) {
            depth++;
        }
        return depth;
    }

    // Navigation

    /**
     * Returns the zipper focused on the leftmost child of the node in focus,
     * if the node is a branch with at least one child.
     */
    public Optional<Zipper<N>> down() {
        return end ? Optional.empty() : firstChild();
    }

    private Optional<Zipper<N>> firstChild() {
        if (!ops.isBranch(loc))
            return Optional.empty();

        Seq<N> children = ops.children(loc);
        if (children.isEmpty())
            return Optional.empty();
        return Optional.of(new Zipper<>(ops, children.head(), Seq.nil(), children.tail(), this, false));
    }

    /**
     * Returns the zipper focused on the parent of the node in focus. The
     * parent node is rebuilt from the current node and its siblings.
     */
    public Optional<Zipper<N>> up() {
        return parent == null ? Optional.empty() : Optional.of(ascend());
    }

    private Zipper<N> ascend() {
        Seq<N> children = left.reverseOnto(Seq.cons(loc, right));
        return parent.withLoc(ops.makeNode(parent.loc, children));
    }

    /**
     * Returns the zipper focused on the left sibling of the node in focus.
     */
    public Optional<Zipper<N>> left() {
        return left.isEmpty() ? Optional.empty() : Optional.of(moveLeft());
    }

    private Zipper<N> moveLeft() {
        return new Zipper<>(ops, left.head(), left.tail(), Seq.cons(loc, right), parent, end);
    }

    /**
     * Returns the zipper focused on the right sibling of the node in focus.
     */
    public Optional<Zipper<N>> right() {
        return right.isEmpty() ? Optional.empty() : Optional.of(moveRight());
    }

    private Zipper<N> moveRight() {
        return new Zipper<>(ops, right.head(), Seq.cons(loc, left), right.tail(), parent, end);
    }

    /**
     * Returns the zipper focused on the first sibling of the node in focus,
     * or this zipper if there is no left sibling.
     */
    public Zipper<N> leftmost() {
        if (left.isEmpty())
            return this;

        N cur = loc;
        Seq<N> ls = left, rs = right;
        while (!ls.isEmpty()) {
            rs = Seq.cons(cur, rs);
            cur = ls.head();
            ls = ls.tail();
        }
        return new Zipper<>(ops, cur, Seq.nil(), rs, parent, end);
    }

    /**
     * Returns the zipper focused on the last sibling of the node in focus,
     * or this zipper if there is no right sibling.
     */
    public Zipper<N> rightmost() {
        if (right.isEmpty())
            return this;

        N cur = loc;
        Seq<N> ls = left, rs = right;
        while (!rs.isEmpty()) {
            ls = Seq.cons(cur, ls);
            cur = rs.head();
            rs = rs.tail();
        }
        return new Zipper<>(ops, cur, ls, Seq.nil(), parent, end);
    }

    /**
     * Returns the top-level zipper, rebuilding every parent on the way up.
     * An ended zipper is already at the top.
     */
    public Zipper<N> top() {
        Zipper<N> z = this;
        while (z.parent != null) {
            z = z.ascend();
        }
        return z;
    }

    /**
     * Returns the root node of the tree, with all edits applied.
     */
    public N root() {
        return top().loc;
    }

    // Depth-first walk

    /**
     * Returns the zipper for the next node in depth-first pre-order. After
     * the last node, returns the top-level zipper marked as ended. Calling
     * {@code next} on an ended zipper returns the same zipper.
     */
    public Zipper<N> next() {
        if (end)
            return this;

        Optional<Zipper<N>> child = down();
        return child.isPresent() ? child.get() : nextSibling();
    }

    /**
     * Moves to the right sibling of this node, or to the right sibling of
     * the nearest parent that has one, without entering the children of
     * this node. Ends the walk when the top is reached.
     */
    private Zipper<N> nextSibling() {
        Zipper<N> z = this;
        while (true) {
            if (!z.right.isEmpty())
                return z.moveRight();
            if (z.parent == null)
                return z.markEnd();
            z = z.ascend();
        }
    }

    private Zipper<N> markEnd() {
        return new Zipper<>(ops, loc, left, right, null, true);
    }

    /**
     * Returns the zipper for the previous node in depth-first pre-order.
     * From an ended zipper, returns the last node of the tree. Returns
     * an empty {@code Optional} at the root.
     */
    public Optional<Zipper<N>> prev() {
        if (end)
            return Optional.of(fresh(loc).lastDescendant());
        if (!left.isEmpty())
            return Optional.of(moveLeft().lastDescendant());
        return up();
    }

    private Zipper<N> lastDescendant() {
        Zipper<N> z = this;
        Optional<Zipper<N>> child = z.down();
        while (child.isPresent()) {
            z = child.get().rightmost();
            child = z.down();
        }
        return z;
    }

    /**
     * Returns the first zipper, in depth-first pre-order starting from this
     * one, that satisfies the given predicate.
     */
    public Optional<Zipper<N>> find(Predicate<? super Zipper<N>> predicate) {
        requireNonNull(predicate);
        for (Zipper<N> z = this; !z.end; z = z.next()) {
            if (predicate.test(z))
                return Optional.of(z);
        }
        return Optional.empty();
    }

    /**
     * Returns the nodes visited by walking {@link #next()} from this zipper
     * until the walk ends. The sequence is lazy: nodes are visited as the
     * sequence is consumed. Use {@code subtree().preorder()} to list the
     * nodes below the current node only.
     */
    public Seq<N> preorder() {
        return end ? Seq.nil() : Seq.cons(loc, () -> next().preorder());
    }

    /**
     * Returns the nodes of {@link #preorder()} as a stream.
     */
    public Stream<N> stream() {
        return preorder().stream();
    }

    // Edits

    /**
     * Replaces the node in focus.
     */
    public Zipper<N> replace(N node) {
        return withLoc(node);
    }

    /**
     * Replaces the node in focus with the result of applying the given
     * function to it.
     */
    public Zipper<N> update(Function<? super N, ? extends N> fn) {
        return withLoc(fn.apply(loc));
    }

    /**
     * Removes the node in focus. Returns the zipper focused on the node
     * that preceded the removed one in depth-first pre-order: the deepest
     * last descendant of the left sibling, or the parent if there is no
     * left sibling.
     *
     * @throws ZipperException if this zipper is at the top
     */
    public Zipper<N> remove() {
        if (parent == null)
            throw new ZipperException("cannot remove the root node");

        if (left.isEmpty())
            return parent.withLoc(ops.makeNode(parent.loc, right));
        return new Zipper<>(ops, left.head(), left.tail(), right, parent, false).lastDescendant();
    }

    /**
     * Inserts a node as the left sibling of the node in focus, without
     * moving.
     *
     * @throws ZipperException if this zipper is at the top
     */
    public Zipper<N> insertLeft(N node) {
        if (parent == null)
            throw new ZipperException("cannot insert a left sibling at the root");
        return new Zipper<>(ops, loc, Seq.cons(node, left), right, parent, false);
    }

    /**
     * Inserts a node as the right sibling of the node in focus, without
     * moving.
     *
     * @throws ZipperException if this zipper is at the top
     */
    public Zipper<N> insertRight(N node) {
        if (parent == null)
            throw new ZipperException("cannot insert a right sibling at the root");
        return new Zipper<>(ops, loc, left, Seq.cons(node, right), parent, false);
    }

    /**
     * Inserts a node as the rightmost child of the node in focus, without
     * moving. A leaf is turned into a branch with a single child.
     */
    public Zipper<N> appendChild(N child) {
        return firstChild()
            .map(z -> new Zipper<>(ops, z.loc, z.left, z.right.append(child), this, false).ascend())
            .orElseGet(() -> withLoc(ops.makeNode(loc, Seq.of(child))));
    }

    /**
     * Inserts a node as the leftmost child of the node in focus, without
     * moving. A leaf is turned into a branch with a single child.
     */
    public Zipper<N> insertChild(N child) {
        return firstChild()
            .map(z -> new Zipper<>(ops, z.loc, Seq.of(child), z.right, this, false).ascend())
            .orElseGet(() -> withLoc(ops.makeNode(loc, Seq.of(child))));
    }

    // Traversals

    /**
     * Replaces every node, in depth-first pre-order, with the result of
     * applying the given function to it. Returns the ended zipper when
     * called at the top, otherwise the zipper at the same position with the
     * subtree replaced.
     */
    public Zipper<N> map(Function<? super N, ? extends N> fn) {
        requireNonNull(fn);
        return traverse(z -> z.update(fn));
    }

    /**
     * Walks the tree in depth-first pre-order, applying the given function
     * to the zipper of each node and continuing from the zipper it returns.
     *
     * <p>At the top (or on an ended zipper) the whole tree is walked and the
     * ended zipper is returned. Below the top only the subtree of the node
     * in focus is walked, and the rebuilt subtree replaces the node in focus
     * of this zipper.</p>
     */
    public Zipper<N> traverse(Function<? super Zipper<N>, ? extends Zipper<N>> fn) {
        requireNonNull(fn);
        Zipper<N> z = subtree();
        while (!z.end) {
            z = fn.apply(z).next();
        }
        return parent == null ? z : withLoc(z.loc);
    }

    /**
     * Walks the tree like {@link #traverse(Function)} while threading an
     * accumulator through every visit.
     */
    public <A> Tuple<Zipper<N>, A> traverse(
        A acc, BiFunction<? super Zipper<N>, ? super A, ? extends Tuple<Zipper<N>, A>> fn)
    {
        requireNonNull(fn);
        Zipper<N> z = subtree();
        while (!z.end) {
            Tuple<Zipper<N>, A> t = fn.apply(z, acc);
            z = t.first().next();
            acc = t.second();
        }
        return Tuple.of(parent == null ? z : withLoc(z.loc), acc);
    }

    /**
     * Walks the tree like {@link #traverse(Function)}, but lets the function
     * decide after each visit whether to continue, to skip the children of
     * the visited node, or to halt.
     *
     * <p>On halt the remaining nodes are left untouched and the returned
     * zipper is the ended top-level zipper of the whole tree, even when the
     * walk was started below the top.</p>
     */
    public Zipper<N> traverseWhile(Function<? super Zipper<N>, ? extends Step<N, ?>> fn) {
        requireNonNull(fn);
        return this.<Object>traverseWhile(null, (z, acc) -> fn.apply(z)).first();
    }

    /**
     * Walks the tree like {@link #traverseWhile(Function)} while threading
     * an accumulator through every visit.
     */
    public <A> Tuple<Zipper<N>, A> traverseWhile(
        A acc, BiFunction<? super Zipper<N>, ? super A, ? extends Step<N, ? extends A>> fn)
    {
        requireNonNull(fn);
        Zipper<N> z = subtree();
        while (!z.end) {
            Step<N, ? extends A> step = fn.apply(z, acc);
            acc = step.acc();
            switch (step.action()) {
            case CONTINUE:
                z = step.zipper().next();
                break;

            case SKIP:
                z = step.zipper().nextSibling();
                break;

            case HALT:
                logger.log(Level.FINE, "traversal halted at {0}", step.zipper());
                Zipper<N> halted = step.zipper().top();
                if (parent != null)
                    halted = withLoc(halted.loc).top();
                return Tuple.of(halted.markEnd(), acc);

            default:
                throw new AssertionError(step.action());
            }
        }
        return Tuple.of(parent == null ? z : withLoc(z.loc), acc);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Zipper))
            return false;
        Zipper<?> other = (Zipper<?>)obj;
        return ops == other.ops
            && end == other.end
            && Objects.equals(loc, other.loc)
            && left.equals(other.left)
            && right.equals(other.right)
            && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loc, left, right, parent, end);
    }

    @Override
    public String toString() {
        return "Zipper<" + loc + ">";
    }
}
