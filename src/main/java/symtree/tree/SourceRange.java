// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

/**
 * A half-open range {@code [pos, end)} of offsets into the source text an expression was read from.
 * <p>
 * Purely informational: equality, containment and navigation of expressions never look at it.
 */
public record SourceRange(int pos, int end) {
    public SourceRange {
        if (pos < 0 || end < pos) {
            throw new IllegalArgumentException("Invalid source range [" + pos + ", " + end + ")");
        }
    }

    public int length() {
        return end - pos;
    }

    @Override
    public String toString() {
        return "[" + pos + ", " + end + ")";
    }
}
