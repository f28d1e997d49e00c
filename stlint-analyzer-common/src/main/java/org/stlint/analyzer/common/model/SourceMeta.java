package org.stlint.analyzer.common.model;

/*
Position of an element. The line/column pairs are absolute (in the source file), the container
pairs are relative to the source text of the routine or declaration section holding the element.
Any component may be null.
 */
public record SourceMeta(Integer line, Integer column, Integer endColumn,
                         Integer containerLine, Integer containerColumn, Integer containerEndColumn) {

    public static SourceMeta inContainer(int containerLine, int containerColumn, Integer containerEndColumn) {
        return new SourceMeta(null, null, null, containerLine, containerColumn, containerEndColumn);
    }

    public static SourceMeta inFile(int line, int column, Integer endColumn) {
        return new SourceMeta(line, column, endColumn, null, null, null);
    }

    public String compact() {
        if (containerLine != null) {
            return containerLine + (containerColumn == null ? "" : ":" + containerColumn);
        }
        if (line != null) {
            return "@" + line + (column == null ? "" : ":" + column);
        }
        return "?";
    }
}
