// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import symtree.util.annotation.Nullable;

/**
 * The handle for any expression in a tree: either a {@link Cons} (a pair or the empty list) or an {@link Atom}.
 * <p>
 * Expressions are guaranteed to be immutable once constructed, so they can be shared between trees and read from
 * multiple threads without synchronization.
 */
public sealed interface Expr permits Atom, Cons {
    /**
     * Returns a stable name identifying the kind of this expression, {@code "Cons"} and {@code "Nil"} for the two
     * list variants.
     */
    String typeName();

    /**
     * Returns {@code true} iff this expression is structurally equal to {@code needle}, or has a part that is.
     * <p>
     * The test is self-inclusive: every expression contains itself.
     */
    boolean contains(Expr needle);

    /**
     * Returns {@code true} iff this expression is structurally equal to {@code other}.
     * <p>
     * Source ranges are never taken into account. An atom is never equal to a list, empty or not.
     */
    boolean isEqualTo(Expr other);

    /**
     * Returns {@code true} iff this expression is a non-empty pair.
     */
    boolean isCons();

    /**
     * Returns {@code true} iff this expression is the empty list.
     */
    boolean isNil();

    /**
     * Returns the span of source text this expression was read from, or {@code null} for synthesized expressions.
     */
    @Nullable SourceRange sourceRange();
}
