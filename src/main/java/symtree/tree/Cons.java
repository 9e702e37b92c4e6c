// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import symtree.util.annotation.Nullable;

/**
 * A list node of an expression tree: either a {@link Pair} holding a head expression and the rest of the list, or the
 * empty list {@link #nil()}.
 * <p>
 * Symbolic expressions are built by connecting pairs. The head of a pair is the element, the rest links to the next
 * pair. For example, {@code a * b + c} is the list {@code (+ (* a b) c)}:
 * <pre>
 *  Pair ------&gt; Pair ----------------------------------&gt; Pair ----&gt; Nil
 *   |            |                                       |
 *   +            Pair ----&gt; Pair ----&gt; Pair ----&gt; Nil     c
 *                |          |          |
 *                *          a          b
 * </pre>
 * The rest of a pair is always a list, never an atom, so dotted lists cannot be represented.
 * <p>
 * Lists are immutable and may share structure. All operations walk the rest chain iteratively, so arbitrarily long
 * lists are fine; only descent into heads recurses.
 */
public abstract sealed class Cons implements Expr, Iterable<Expr> permits Cons.Pair, Cons.Nil {
    private Cons() {
    }

    /**
     * Returns the empty list.
     * <p>
     * There is exactly one empty list per process, so identity comparison against it is a valid emptiness test.
     */
    public static Cons nil() {
        return Nil.instance;
    }

    /**
     * Returns a new pair with the given head and rest.
     */
    public static Pair cons(final Expr head, final Cons rest) {
        return new Pair(head, rest, null);
    }

    /**
     * Returns a new pair with the given head and rest, read from the given range of source text.
     */
    public static Pair cons(final Expr head, final Cons rest, final @Nullable SourceRange range) {
        return new Pair(head, rest, range);
    }

    /**
     * Returns a list of the given items, in order.
     * <p>
     * With no items, returns {@link #nil()}.
     */
    public static Cons of(final Expr... items) {
        return ofRange(null, items);
    }

    /**
     * Returns a list of the given items, in order, with every pair of the list carrying the given source range.
     * <p>
     * With no items, returns {@link #nil()}, which never carries a range.
     */
    public static Cons ofRange(final @Nullable SourceRange range, final Expr... items) {
        Cons list = nil();
        // Build from the end so every intermediate result is already a list.
        for (int i = items.length - 1; i >= 0; i -= 1) {
            list = new Pair(items[i], list, range);
        }
        return list;
    }

    /**
     * Returns a list of the items produced by the iterator of the given iterable, in the order they were produced.
     */
    public static Cons fromIterable(final Iterable<? extends Expr> items) {
        final var builder = new Builder();
        builder.addAll(items);
        return builder.freeze();
    }

    /**
     * Returns the first element of this list, or {@link #nil()} if this list is empty.
     */
    public abstract Expr head();

    /**
     * Returns this list without its first element, or {@link #nil()} if this list is empty.
     */
    public abstract Cons rest();

    /**
     * Same as {@link #rest()}, for code that treats the list as an operator applied to arguments.
     */
    public final Cons argList() {
        return rest();
    }

    /**
     * Returns the number of elements of this list.
     */
    @CheckReturnValue
    public final int length() {
        int length = 0;
        for (Cons list = this; list instanceof Pair pair; list = pair.rest) {
            length += 1;
        }
        return length;
    }

    /**
     * Returns the element at the given zero-based index.
     *
     * @throws IndexError if the index is negative, or not less than the length of this list
     */
    public final Expr item(final int index) {
        if (index >= 0) {
            int remaining = index;
            for (Cons list = this; list instanceof Pair pair; list = pair.rest) {
                if (remaining == 0) {
                    return pair.head;
                }
                remaining -= 1;
            }
        }
        throw new IndexError(index, length());
    }

    /**
     * The operator of an {@code (operator operand...)} expression, same as {@code item(0)}.
     */
    public final Expr operator() {
        return item(0);
    }

    /**
     * The operand of a unary expression, same as {@code item(1)}.
     */
    public final Expr operand() {
        return item(1);
    }

    /**
     * The left operand of a binary expression, same as {@code item(1)}.
     */
    public final Expr leftOperand() {
        return item(1);
    }

    /**
     * The right operand of a binary expression, same as {@code item(2)}.
     */
    public final Expr rightOperand() {
        return item(2);
    }

    /**
     * The base of a {@code (power base exponent)} expression, same as {@code item(1)}.
     */
    public final Expr base() {
        return item(1);
    }

    /**
     * The exponent of a {@code (power base exponent)} expression, same as {@code item(2)}.
     */
    public final Expr exponent() {
        return item(2);
    }

    /**
     * Returns every element except the first, in order.
     * <p>
     * The returned list is unmodifiable and holds the very same element objects as this list.
     *
     * @throws EmptyListError if this list is empty
     */
    public final List<Expr> tail() {
        if (!(this instanceof Pair pair)) {
            throw new EmptyListError("tail");
        }
        final var items = new ArrayList<Expr>();
        for (final var item : pair.rest) {
            items.add(item);
        }
        return Collections.unmodifiableList(items);
    }

    /**
     * Returns a new list of the results of applying the given function to the elements of this list, in order.
     * <p>
     * Each pair of the result carries the source range of the corresponding pair of this list. The empty list maps to
     * itself. Exceptions thrown by the function are passed through.
     */
    @CheckReturnValue
    public final Cons map(final Function<? super Expr, ? extends Expr> function) {
        if (!(this instanceof Pair)) {
            return this;
        }
        final var pairs = new ArrayList<Pair>();
        final var mapped = new ArrayList<Expr>();
        for (Cons list = this; list instanceof Pair pair; list = pair.rest) {
            pairs.add(pair);
            mapped.add(Objects.requireNonNull(function.apply(pair.head), "Mapping function returned null"));
        }
        Cons result = nil();
        for (int i = pairs.size() - 1; i >= 0; i -= 1) {
            result = new Pair(mapped.get(i), result, pairs.get(i).range);
        }
        return result;
    }

    /**
     * Returns a new iterator over the elements of this list, from the first to the last.
     * <p>
     * Iterators are independent of each other; the list itself is never affected by iteration.
     */
    @Override
    public final Iterator<Expr> iterator() {
        return new Itr(this);
    }

    @Override
    public final Spliterator<Expr> spliterator() {
        return Spliterators.spliteratorUnknownSize(
            iterator(),
            Spliterator.ORDERED | Spliterator.IMMUTABLE | Spliterator.NONNULL
        );
    }

    /**
     * Returns a sequential stream of the elements of this list.
     */
    public final Stream<Expr> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Returns {@code true} iff this list is structurally equal to {@code needle}, or any element of this list
     * contains {@code needle}, or any rest of this list is structurally equal to {@code needle}.
     * <p>
     * Every list therefore contains itself, its suffixes, and the empty list.
     */
    @Override
    public final boolean contains(final Expr needle) {
        Cons list = this;
        while (list instanceof Pair pair) {
            if (pair.isEqualTo(needle) || pair.head.contains(needle)) {
                return true;
            }
            list = pair.rest;
        }
        return list.isEqualTo(needle);
    }

    /**
     * Returns {@code true} iff {@code other} is a list of the same length whose elements are pairwise
     * {@link Trees#equal(Expr, Expr) equal} to the elements of this list.
     */
    @Override
    public final boolean isEqualTo(final Expr other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Cons otherList)) {
            return false;
        }
        Cons lhs = this;
        Cons rhs = otherList;
        while (lhs instanceof Pair lhsPair && rhs instanceof Pair rhsPair) {
            if (lhsPair == rhsPair) {
                // Shared tail.
                return true;
            }
            if (!Trees.equal(lhsPair.head, rhsPair.head)) {
                return false;
            }
            lhs = lhsPair.rest;
            rhs = rhsPair.rest;
        }
        return lhs.isNil() && rhs.isNil();
    }

    /**
     * Same as {@link #isEqualTo(Expr)} for expressions, {@code false} for any other object.
     */
    @Override
    public final boolean equals(final @Nullable Object object) {
        return object instanceof Expr expr && isEqualTo(expr);
    }

    /**
     * Returns a hash code computed from the hash codes of the elements, consistent with {@link #isEqualTo(Expr)}.
     */
    @Override
    public final int hashCode() {
        int hash = 1;
        for (Cons list = this; list instanceof Pair pair; list = pair.rest) {
            hash = 31 * hash + pair.head.hashCode();
        }
        return hash;
    }

    /**
     * Returns the fully nested representation of this list: the pair {@code (head rest)} with both halves rendered
     * recursively, the empty list as {@code ()}.
     * <p>
     * The list of {@code a}, {@code b} and {@code c} is thus rendered as {@code (a (b (c ())))}.
     */
    @Override
    public final String toString() {
        final var builder = new StringBuilder();
        int depth = 0;
        for (Cons list = this; list instanceof Pair pair; list = pair.rest) {
            builder.append('(').append(pair.head).append(' ');
            depth += 1;
        }
        builder.append("()");
        builder.append(")".repeat(depth));
        return builder.toString();
    }

    /**
     * A non-empty list: a head element followed by the rest of the list.
     */
    public static final class Pair extends Cons {
        private Pair(final Expr head, final Cons rest, final @Nullable SourceRange range) {
            this.head = Objects.requireNonNull(head, "head");
            this.rest = Objects.requireNonNull(rest, "rest");
            this.range = range;
        }

        @Override
        public String typeName() {
            return "Cons";
        }

        @Override
        public Expr head() {
            return head;
        }

        @Override
        public Cons rest() {
            return rest;
        }

        @Override
        public boolean isCons() {
            return true;
        }

        @Override
        public boolean isNil() {
            return false;
        }

        @Override
        public @Nullable SourceRange sourceRange() {
            return range;
        }

        private final Expr head;
        private final Cons rest;
        private final @Nullable SourceRange range;
    }

    /**
     * The empty list. Its only instance is {@link Cons#nil()}.
     */
    public static final class Nil extends Cons {
        private Nil() {
        }

        @Override
        public String typeName() {
            return "Nil";
        }

        @Override
        public Expr head() {
            return this;
        }

        @Override
        public Cons rest() {
            return this;
        }

        @Override
        public boolean isCons() {
            return false;
        }

        @Override
        public boolean isNil() {
            return true;
        }

        @Override
        public @Nullable SourceRange sourceRange() {
            return null;
        }

        private static final Nil instance = new Nil();
    }

    /**
     * Collects elements in order and turns them into a list.
     * <p>
     * Builders are mutable and not thread-safe; the lists they produce are immutable like any other.
     */
    public static final class Builder {
        /**
         * Adds the given element after the elements added so far.
         */
        public void add(final Expr item) {
            items.add(Objects.requireNonNull(item, "item"));
        }

        /**
         * Adds all elements produced by the iterator of the given iterable, in the order they were produced.
         */
        public void addAll(final Iterable<? extends Expr> iterable) {
            for (final var item : iterable) {
                add(item);
            }
        }

        /**
         * Returns the number of elements added so far.
         */
        public int size() {
            return items.size();
        }

        /**
         * Returns {@code true} iff no elements were added so far.
         */
        public boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * Returns a list of the added elements, and clears this builder.
         */
        public Cons freeze() {
            return freeze(null);
        }

        /**
         * Returns a list of the added elements with every pair carrying the given source range, and clears this
         * builder.
         */
        public Cons freeze(final @Nullable SourceRange range) {
            Cons list = nil();
            for (int i = items.size() - 1; i >= 0; i -= 1) {
                list = new Pair(items.get(i), list, range);
            }
            items.clear();
            return list;
        }

        private final ArrayList<Expr> items = new ArrayList<>();
    }

    private static final class Itr implements Iterator<Expr> {
        private Itr(final Cons list) {
            current = list;
        }

        @Override
        public boolean hasNext() {
            return current instanceof Pair;
        }

        @Override
        @SuppressFBWarnings(value = "IT_NO_SUCH_ELEMENT", justification = "It can, SpotBugs is confused")
        public Expr next() {
            if (!(current instanceof Pair pair)) {
                throw new NoSuchElementException("No more elements");
            }
            current = pair.rest;
            return pair.head;
        }

        private Cons current;
    }
}
