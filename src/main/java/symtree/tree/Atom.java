// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import symtree.util.annotation.Nullable;

/**
 * Base interface for every leaf expression kind: symbols, numbers, strings and whatever else client code puts in its
 * trees.
 * <p>
 * Implementations must be immutable. {@link #isEqualTo(Expr)} must return {@code false} for any {@link Cons}, and
 * {@link Object#hashCode()} must agree with {@link #isEqualTo(Expr)}, because list hash codes are computed from the
 * hash codes of their elements.
 */
public non-sealed interface Atom extends Expr {
    /**
     * Atoms have no parts, so containment is plain equality.
     */
    @Override
    default boolean contains(final Expr needle) {
        return this == needle || isEqualTo(needle);
    }

    @Override
    default boolean isCons() {
        return false;
    }

    @Override
    default boolean isNil() {
        return false;
    }

    @Override
    default @Nullable SourceRange sourceRange() {
        return null;
    }
}
