package org.dxworks.mdast.syntax.commonmark;

import java.util.ArrayList;
import java.util.List;

/**
 * Line table of a source text. Lines end at {@code \n}, {@code \r\n} or {@code \r}, the same
 * way commonmark splits its input, so that (line, column) source spans map back to offsets.
 */
final class SourceLines {

    private final String source;
    private final int[] starts;
    private final int[] ends; // exclusive, line terminator excluded

    SourceLines(String source) {
        this.source = source;
        List<Integer> startList = new ArrayList<>();
        List<Integer> endList = new ArrayList<>();
        int lineStart = 0;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                startList.add(lineStart);
                endList.add(i);
                i += (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') ? 2 : 1;
                lineStart = i;
            } else {
                i++;
            }
        }
        startList.add(lineStart);
        endList.add(source.length());

        starts = startList.stream().mapToInt(Integer::intValue).toArray();
        ends = endList.stream().mapToInt(Integer::intValue).toArray();
    }

    int count() {
        return starts.length;
    }

    int start(int line) {
        return starts[clampLine(line)];
    }

    int end(int line) {
        return ends[clampLine(line)];
    }

    int offset(int line, int column) {
        if (line >= starts.length) return source.length();
        return Math.min(starts[line] + column, source.length());
    }

    /** Index of the line containing {@code offset}; a terminator belongs to its line. */
    int lineOf(int offset) {
        int low = 0;
        int high = starts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (starts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    /** First offset in {@code [from, to)} that is not a space or tab, or {@code to}. */
    int skipBlanks(int from, int to) {
        int pos = from;
        while (pos < to && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) pos++;
        return pos;
    }

    /** End of {@code [from, to)} with trailing spaces and tabs removed. */
    int trimEnd(int from, int to) {
        int pos = to;
        while (pos > from && (source.charAt(pos - 1) == ' ' || source.charAt(pos - 1) == '\t')) pos--;
        return pos;
    }

    private int clampLine(int line) {
        return Math.max(0, Math.min(line, starts.length - 1));
    }
}
