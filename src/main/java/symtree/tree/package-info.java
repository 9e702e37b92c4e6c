// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Immutable cons-cell trees used as the node representation of symbolic expressions.
 * <p>
 * A tree is built from {@link symtree.tree.Cons} pairs, terminated by the single empty list {@link
 * symtree.tree.Cons#nil()}, with {@link symtree.tree.Atom atoms} supplied by client code at the leaves.
 */
@NonNullByDefault
package symtree.tree;

import symtree.util.annotation.NonNullByDefault;
