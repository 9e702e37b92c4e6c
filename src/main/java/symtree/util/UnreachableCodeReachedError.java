// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow reaches a branch the type hierarchy rules out, such as a third variant of a sealed type.
 * <p>
 * This is a programming error, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
