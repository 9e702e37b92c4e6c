// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import java.util.List;
import symtree.util.Trace;

/**
 * Thrown when a pair is constructed with a rest that is not a list.
 */
public final class ShapeError extends IllegalArgumentException implements TreeError {
    ShapeError(final Expr rest) {
        super("Rest of a pair must be a list, got " + rest.typeName() + ": " + rest);
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
