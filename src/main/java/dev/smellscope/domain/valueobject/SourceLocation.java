package dev.smellscope.domain.valueobject;

import java.util.Comparator;

/**
 * A source range. Lines are 1-based and inclusive; a column of 0 means the
 * whole line.
 */
public record SourceLocation(String file, int startLine, int startColumn, int endLine, int endColumn) {

    /** File, then start line, then start column. */
    public static final Comparator<SourceLocation> POSITION_ORDER =
            Comparator.comparing(SourceLocation::file)
                    .thenComparingInt(SourceLocation::startLine)
                    .thenComparingInt(SourceLocation::startColumn);

    /** Fewest lines first, then the narrowest column extent. */
    public static final Comparator<SourceLocation> TIGHTNESS_ORDER =
            Comparator.comparingInt(SourceLocation::lineSpan)
                    .thenComparingInt(SourceLocation::columnExtent);

    public SourceLocation {
        if (file == null) file = "";
        if (startColumn < 0) startColumn = 0;
        if (endColumn < 0) endColumn = 0;
    }

    public static SourceLocation lines(String file, int startLine, int endLine) {
        return new SourceLocation(file, startLine, 0, endLine, 0);
    }

    public SourceLocation withDefaultFile(String defaultFile) {
        if (!file.isBlank() || defaultFile == null) return this;
        return new SourceLocation(defaultFile, startLine, startColumn, endLine, endColumn);
    }

    public int lineSpan() {
        return endLine - startLine + 1;
    }

    public int columnExtent() {
        return Math.max(0, endColumn - startColumn);
    }

    /**
     * True when the range is well formed and fits inside a source of
     * {@code lineCount} lines.
     */
    public boolean isWithin(int lineCount) {
        return startLine >= 1 && endLine >= startLine && endLine <= lineCount;
    }

    /**
     * Overlapping lines divided by the line span of the shorter range.
     * 0.0 for ranges in different files or that share no position; on a
     * shared boundary line the column ranges must touch, with column 0
     * standing for the whole line.
     */
    public double overlapRatio(SourceLocation other) {
        if (!file.equals(other.file)) return 0.0;
        if (!intersects(other)) return 0.0;
        int overlap = Math.min(endLine, other.endLine) - Math.max(startLine, other.startLine) + 1;
        int shorter = Math.min(lineSpan(), other.lineSpan());
        return (double) overlap / shorter;
    }

    private boolean intersects(SourceLocation other) {
        return comparePosition(startLine, startColumn, other.endLine, endColumnBound(other.endColumn)) <= 0
                && comparePosition(other.startLine, other.startColumn, endLine, endColumnBound(endColumn)) <= 0;
    }

    private static int endColumnBound(int endColumn) {
        return endColumn == 0 ? Integer.MAX_VALUE : endColumn;
    }

    private static int comparePosition(int line, int column, int otherLine, int otherColumn) {
        int byLine = Integer.compare(line, otherLine);
        return byLine != 0 ? byLine : Integer.compare(column, otherColumn);
    }
}
