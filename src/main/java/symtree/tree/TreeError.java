// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.tree;

import java.util.List;
import symtree.util.Trace;
import symtree.util.annotation.Nullable;

/**
 * Common interface of the exceptions signalling misuse of a tree: malformed construction or out-of-range access.
 * <p>
 * These are programming errors rather than recoverable conditions, so all of them are unchecked. Each one records the
 * {@link Trace traces} that were active on the throwing thread when it was created.
 */
public sealed interface TreeError permits EmptyListError, IndexError, ShapeError {
    /**
     * Returns the short message describing the misuse.
     */
    @Nullable String getMessage();

    /**
     * Returns the trace messages active when this error was created, innermost first.
     */
    List<String> traces();

    /**
     * Returns the message followed by the recorded operation trace, one trace message per line.
     */
    default String detailedMessage() {
        final var builder = new StringBuilder();
        builder.append(getMessage());
        final var traces = traces();
        if (!traces.isEmpty()) {
            builder.append("\nOperation trace:");
            for (final var trace : traces) {
                builder.append("\n - ").append(trace);
            }
        }
        return builder.toString();
    }
}
