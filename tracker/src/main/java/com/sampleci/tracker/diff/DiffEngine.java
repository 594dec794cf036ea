package com.sampleci.tracker.diff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-based comparison of an expected and an actual output.
 *
 * The alignment is a longest common subsequence, computed with Hirschberg's
 * divide and conquer so memory stays linear in the line counts. Before
 * aligning, the common prefix and suffix are stripped and lines that occur
 * on one side only are set aside, since they can never be matched. Two
 * outputs that differ everywhere therefore cost no alignment work at all.
 *
 * Pure static functions with no shared state: safe to call from any number
 * of threads on independent inputs, and the same input always gives
 * byte-identical output.
 */
public final class DiffEngine {

    private DiffEngine() {}

    /** Align the two sequences and render the result as HTML. */
    public static String computeDiff(List<String> expectedLines, List<String> actualLines, RenderMode mode) {
        return HtmlDiffRenderer.render(compare(expectedLines, actualLines), mode);
    }

    /**
     * Align the two sequences into groups.
     *
     * Every maximal stretch of non-equal lines becomes one group: CHANGED if
     * it both drops and adds lines, REMOVED or ADDED otherwise. Null inputs
     * are treated as empty.
     */
    public static List<DiffGroup> compare(List<String> expectedLines, List<String> actualLines) {
        List<String> a = expectedLines == null ? List.of() : expectedLines;
        List<String> b = actualLines   == null ? List.of() : actualLines;

        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        GroupCollector out = new GroupCollector(a, b);
        out.equal(prefix);

        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);
        emitMiddle(midA, midB, out);

        out.equal(suffix);
        return out.finish();
    }

    /** Number of groups of the given kind. */
    public static int count(List<DiffGroup> groups, DiffKind kind) {
        return (int) groups.stream().filter(g -> g.kind() == kind).count();
    }

    /**
     * Emit edit operations for the region between the common prefix and suffix.
     */
    private static void emitMiddle(List<String> midA, List<String> midB, GroupCollector out) {
        Map<String, Integer> ids = new HashMap<>();
        int[] idsA = toIds(midA, ids);
        int[] idsB = toIds(midB, ids);

        boolean[] inA = new boolean[ids.size()];
        boolean[] inB = new boolean[ids.size()];
        for (int id : idsA) inA[id] = true;
        for (int id : idsB) inB[id] = true;

        // positions of lines that have a partner somewhere on the other side
        int[] keptA = positionsPresentIn(idsA, inB);
        int[] keptB = positionsPresentIn(idsB, inA);
        int[] seqA = select(idsA, keptA);
        int[] seqB = select(idsB, keptB);

        Matches matches = new Matches(Math.min(seqA.length, seqB.length));
        align(seqA, 0, seqA.length, seqB, 0, seqB.length, matches);

        int i = 0;
        int j = 0;
        for (int k = 0; k < matches.size; k++) {
            int matchA = keptA[matches.a[k]];
            int matchB = keptB[matches.b[k]];
            for (; i < matchA; i++) out.removed();
            for (; j < matchB; j++) out.added();
            out.equal(1);
            i++;
            j++;
        }
        for (; i < midA.size(); i++) out.removed();
        for (; j < midB.size(); j++) out.added();
    }

    /**
     * Hirschberg: split a in half, find where the optimal path crosses the
     * middle row using two linear-space LCS length passes, recurse on both
     * halves. Matches are appended in increasing order.
     */
    private static void align(int[] a, int aLo, int aHi, int[] b, int bLo, int bHi, Matches out) {
        if (aLo >= aHi || bLo >= bHi) return;
        if (aHi - aLo == 1) {
            for (int j = bLo; j < bHi; j++) {
                if (a[aLo] == b[j]) {
                    out.add(aLo, j);
                    return;
                }
            }
            return;
        }

        int mid = (aLo + aHi) >>> 1;
        int[] head = forwardLengths(a, aLo, mid, b, bLo, bHi);
        int[] tail = backwardLengths(a, mid, aHi, b, bLo, bHi);

        int split = 0;
        int best = -1;
        for (int k = 0; k <= bHi - bLo; k++) {
            int total = head[k] + tail[k];
            if (total > best) {
                best = total;
                split = k;
            }
        }
        align(a, aLo, mid, b, bLo, bLo + split, out);
        align(a, mid, aHi, b, bLo + split, bHi, out);
    }

    // r[k] = LCS length of a[aLo..aHi) and b[bLo..bLo+k)
    private static int[] forwardLengths(int[] a, int aLo, int aHi, int[] b, int bLo, int bHi) {
        int m = bHi - bLo;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int i = aLo; i < aHi; i++) {
            cur[0] = 0;
            for (int k = 1; k <= m; k++) {
                cur[k] = a[i] == b[bLo + k - 1]
                        ? prev[k - 1] + 1
                        : Math.max(prev[k], cur[k - 1]);
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    // r[k] = LCS length of a[aLo..aHi) and b[bLo+k..bHi)
    private static int[] backwardLengths(int[] a, int aLo, int aHi, int[] b, int bLo, int bHi) {
        int m = bHi - bLo;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int i = aHi - 1; i >= aLo; i--) {
            cur[m] = 0;
            for (int k = m - 1; k >= 0; k--) {
                cur[k] = a[i] == b[bLo + k]
                        ? prev[k + 1] + 1
                        : Math.max(prev[k], cur[k + 1]);
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    private static int[] toIds(List<String> lines, Map<String, Integer> ids) {
        int[] out = new int[lines.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ids.computeIfAbsent(lines.get(i), line -> ids.size());
        }
        return out;
    }

    private static int[] positionsPresentIn(int[] seq, boolean[] present) {
        int count = 0;
        for (int id : seq) if (present[id]) count++;
        int[] out = new int[count];
        int n = 0;
        for (int i = 0; i < seq.length; i++) {
            if (present[seq[i]]) out[n++] = i;
        }
        return out;
    }

    private static int[] select(int[] seq, int[] positions) {
        int[] out = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            out[i] = seq[positions[i]];
        }
        return out;
    }

    /** Matched index pairs, in order. */
    private static final class Matches {
        final int[] a;
        final int[] b;
        int size = 0;

        Matches(int capacity) {
            this.a = new int[capacity];
            this.b = new int[capacity];
        }

        void add(int i, int j) {
            a[size] = i;
            b[size] = j;
            size++;
        }
    }

    /**
     * Turns a stream of per-line edit operations into groups.
     * Tracks absolute positions in both inputs.
     */
    private static final class GroupCollector {

        private final List<String> a;
        private final List<String> b;
        private final List<DiffGroup> groups = new ArrayList<>();

        private int posA = 0;
        private int posB = 0;

        // Open equal run.
        private int equalCount = 0;

        // Open non-equal block.
        private int blockStartA = -1;
        private int blockStartB = -1;

        GroupCollector(List<String> a, List<String> b) {
            this.a = a;
            this.b = b;
        }

        void equal(int lines) {
            if (lines == 0) return;
            flushBlock();
            equalCount += lines;
            posA += lines;
            posB += lines;
        }

        void removed() {
            openBlock();
            posA++;
        }

        void added() {
            openBlock();
            posB++;
        }

        List<DiffGroup> finish() {
            flushEqual();
            flushBlock();
            return List.copyOf(groups);
        }

        private void openBlock() {
            if (blockStartA >= 0) return;
            flushEqual();
            blockStartA = posA;
            blockStartB = posB;
        }

        private void flushEqual() {
            if (equalCount == 0) return;
            int startA = posA - equalCount;
            int startB = posB - equalCount;
            groups.add(new DiffGroup(DiffKind.EQUAL,
                    startA + 1, a.subList(startA, posA),
                    startB + 1, b.subList(startB, posB)));
            equalCount = 0;
        }

        private void flushBlock() {
            if (blockStartA < 0) return;
            List<String> removed = a.subList(blockStartA, posA);
            List<String> added   = b.subList(blockStartB, posB);
            DiffKind kind;
            if (!removed.isEmpty() && !added.isEmpty()) {
                kind = DiffKind.CHANGED;
            } else if (removed.isEmpty()) {
                kind = DiffKind.ADDED;
            } else {
                kind = DiffKind.REMOVED;
            }
            groups.add(new DiffGroup(kind, blockStartA + 1, removed, blockStartB + 1, added));
            blockStartA = -1;
            blockStartB = -1;
        }
    }
}
