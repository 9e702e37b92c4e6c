// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import symtree.util.UnreachableCodeReachedError;
import symtree.util.annotation.Nullable;

/**
 * A utility class containing the classic Lisp operations on expressions.
 * <p>
 * Unlike the corresponding methods of {@link Cons}, the accessors and predicates here accept any expression, including
 * atoms and {@code null}, and never throw.
 */
public final class Trees {
    private Trees() {
    }

    /**
     * Returns the head of {@code expr} if it is a non-empty list, otherwise the empty list.
     */
    public static Expr car(final @Nullable Expr expr) {
        return (expr instanceof Cons.Pair pair) ? pair.head() : Cons.nil();
    }

    /**
     * Returns the rest of {@code expr} if it is a non-empty list, otherwise the empty list.
     */
    public static Cons cdr(final @Nullable Expr expr) {
        return (expr instanceof Cons.Pair pair) ? pair.rest() : Cons.nil();
    }

    /**
     * Returns a new pair with the given head and rest.
     *
     * @throws ShapeError if {@code rest} is not a list
     */
    public static Cons.Pair cons(final Expr head, final Expr rest) {
        return cons(head, rest, null);
    }

    /**
     * Returns a new pair with the given head and rest, read from the given range of source text.
     *
     * @throws ShapeError if {@code rest} is not a list
     */
    public static Cons.Pair cons(final Expr head, final Expr rest, final @Nullable SourceRange range) {
        if (rest instanceof Cons list) {
            return Cons.cons(head, list, range);
        }
        throw new ShapeError(rest);
    }

    /**
     * Returns a list of the given items, in order. See {@link Cons#of(Expr...)}.
     */
    public static Cons list(final Expr... items) {
        return Cons.of(items);
    }

    /**
     * Returns a list of the given items, in order, every pair carrying the given source range. See
     * {@link Cons#ofRange(SourceRange, Expr...)}.
     */
    public static Cons listAt(final @Nullable SourceRange range, final Expr... items) {
        return Cons.ofRange(range, items);
    }

    /**
     * Returns {@code true} iff {@code expr} is an atom: present, and neither a non-empty list nor the empty list.
     */
    public static boolean isAtom(final @Nullable Expr expr) {
        return expr instanceof Atom;
    }

    /**
     * Returns {@code true} iff {@code expr} is a non-empty list.
     * <p>
     * To test for the empty list, use {@link #isNil(Expr)} or compare with {@link Cons#nil()} by identity.
     */
    public static boolean isCons(final @Nullable Expr expr) {
        return expr instanceof Cons.Pair;
    }

    /**
     * Returns {@code true} iff {@code expr} is structurally equal to the empty list.
     */
    public static boolean isNil(final @Nullable Expr expr) {
        return expr != null && Cons.nil().isEqualTo(expr);
    }

    /**
     * Returns {@code true} iff {@code expr} is a list of exactly one element.
     */
    public static boolean isSingleton(final @Nullable Expr expr) {
        return expr instanceof Cons.Pair pair && pair.rest().isNil();
    }

    /**
     * Returns {@code true} iff the two expressions are structurally equal.
     * <p>
     * Lists are compared element by element, walking both rest chains in lock-step. A list is never equal to an atom;
     * two atoms are compared by the atom's own {@link Expr#isEqualTo(Expr)}.
     */
    public static boolean equal(final Expr lhs, final Expr rhs) {
        if (lhs == rhs) {
            return true;
        }
        if (lhs instanceof Cons list) {
            return list.isEqualTo(rhs);
        }
        if (rhs instanceof Cons) {
            return false;
        }
        if (lhs instanceof Atom atom) {
            return atom.isEqualTo(rhs);
        }
        throw new UnreachableCodeReachedError("Expression is neither a list nor an atom: " + lhs.getClass());
    }
}
