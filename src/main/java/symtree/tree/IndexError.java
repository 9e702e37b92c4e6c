// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import java.util.List;
import symtree.util.Trace;

/**
 * Thrown by positional access to a list with a negative index or one past its last element.
 */
public final class IndexError extends IndexOutOfBoundsException implements TreeError {
    IndexError(final int index, final int length) {
        super("Index " + index + " out of bounds for list of length " + length);
        this.index = index;
        this.length = length;
        traces = Trace.snapshot();
    }

    /**
     * Returns the offending index.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the length of the list that was accessed.
     */
    public int length() {
        return length;
    }

    @Override
    public List<String> traces() {
        return traces;
    }

    private static final long serialVersionUID = 1L;

    private final int index;
    private final int length;
    @SuppressWarnings("serial")
    private final List<String> traces;
}
