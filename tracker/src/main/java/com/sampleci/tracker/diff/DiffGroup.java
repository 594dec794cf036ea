package com.sampleci.tracker.diff;

import java.util.List;

/**
 * A maximal run of lines with the same diff kind.
 *
 * Line numbers are 1-based. For ADDED groups expected is empty and
 * expectedStart is the line the insertion happens before; REMOVED is the
 * mirror image.
 */
public record DiffGroup(
        DiffKind     kind,
        int          expectedStart,
        List<String> expected,
        int          actualStart,
        List<String> actual
) {
    public DiffGroup {
        expected = List.copyOf(expected);
        actual   = List.copyOf(actual);
    }
}
