// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import java.util.List;
import java.util.NoSuchElementException;
import symtree.util.Trace;

/**
 * Thrown when an operation that needs at least one element, like {@link Cons#tail()}, is applied to the empty list.
 */
public final class EmptyListError extends NoSuchElementException implements TreeError {
    EmptyListError(final String operation) {
        super(operation + " is not allowed for the empty list");
        traces = Trace.snapshot();
    }

    @Override
    public List<String> traces() {
        return traces;
    }

    private static final long serialVersionUID = 1L;

    @SuppressWarnings("serial")
    private final List<String> traces;
}
