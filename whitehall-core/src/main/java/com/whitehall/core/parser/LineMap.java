package com.whitehall.core.parser;

import com.whitehall.core.ast.SourcePosition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts character offsets into line and column positions.
 */
final class LineMap {

    private final int[] lineStarts;
    private final int baseLine;
    private final int baseColumn;

    LineMap(String source) {
        this(source, 1, 1);
    }

    /**
     * Creates a map for a fragment that begins at the given position of an enclosing file.
     */
    LineMap(String source, int baseLine, int baseColumn) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.baseLine = baseLine;
        this.baseColumn = baseColumn;
    }

    SourcePosition positionOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        int column = offset - lineStarts[line] + 1;
        if (line == 0) {
            column += baseColumn - 1;
        }
        return new SourcePosition(line + baseLine, column);
    }
}
